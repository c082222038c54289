package com.quillvault.export.scheduler.render;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.RenderException;
import com.quillvault.export.scheduler.model.JournalEntry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.jsoup.safety.Safelist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders journal entries to an A4 PDF: Thymeleaf builds the HTML, jsoup cleans each entry body
 * and turns the page into a W3C DOM, and OpenHTMLtoPDF lays it out.
 *
 * <p>Uses its own {@link TemplateEngine} rather than Spring's web one so it also works outside a
 * running application context.
 */
@Service
public class PdfDocumentRenderer implements DocumentRenderer {

  private static final Logger log = LoggerFactory.getLogger(PdfDocumentRenderer.class);

  static final String TEMPLATE = "export/journal-export";
  private static final DateTimeFormatter ENTRY_DATE =
      DateTimeFormatter.ofPattern("MMMM d, yyyy 'at' h:mm a", Locale.ENGLISH);

  // Editor HTML may embed images as data URIs and use inline styles.
  private static final Safelist ENTRY_SAFELIST =
      Safelist.relaxed()
          .addProtocols("img", "src", "http", "https", "data")
          .addAttributes(":all", "style");

  private final TemplateEngine templateEngine;
  private final Clock clock;
  private final ZoneId zoneId;

  public PdfDocumentRenderer(AppProperties appProps, Clock clock) {
    this.templateEngine = createTemplateEngine();
    this.clock = clock;
    this.zoneId =
        appProps.render() != null && appProps.render().zoneId() != null
            ? ZoneId.of(appProps.render().zoneId())
            : ZoneId.of("UTC");
  }

  @Override
  public RenderedDocument render(String title, List<JournalEntry> entries) {
    long startTime = System.currentTimeMillis();
    try {
      String html = renderHtml(title, entries);
      byte[] pdf = htmlToPdf(html);
      String fileName = "journal-export-" + LocalDate.now(clock.withZone(zoneId)) + ".pdf";
      log.debug(
          "Rendered {} entries into {} ({} bytes, took {}ms)",
          entries.size(),
          fileName,
          pdf.length,
          System.currentTimeMillis() - startTime);
      return new RenderedDocument(pdf, fileName, "application/pdf");
    } catch (RenderException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RenderException("Failed to render export document: " + e.getMessage(), e);
    }
  }

  String renderHtml(String title, List<JournalEntry> entries) {
    List<JournalEntry> ordered = new ArrayList<>(entries);
    ordered.sort(
        Comparator.comparing(
                JournalEntry::createdAt, Comparator.nullsLast(Comparator.<Long>naturalOrder()))
            .reversed());

    List<Map<String, Object>> views = new ArrayList<>(ordered.size());
    for (JournalEntry entry : ordered) {
      Map<String, Object> view = new HashMap<>();
      view.put("title", entry.displayTitle());
      view.put("createdAt", formatTimestamp(entry.createdAt()));
      view.put("content", cleanContent(entry.content()));
      views.add(view);
    }

    Context ctx = new Context(Locale.ENGLISH);
    ctx.setVariable("title", title == null || title.isBlank() ? "Journal Export" : title);
    ctx.setVariable("entryCount", ordered.size());
    ctx.setVariable("generatedAt", ENTRY_DATE.format(Instant.now(clock).atZone(zoneId)));
    ctx.setVariable("entries", views);
    return templateEngine.process(TEMPLATE, ctx);
  }

  private byte[] htmlToPdf(String html) {
    org.jsoup.nodes.Document parsed = Jsoup.parse(html);
    parsed.outputSettings().charset(StandardCharsets.UTF_8);
    try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
      PdfRendererBuilder builder = new PdfRendererBuilder();
      builder.useFastMode();
      builder.withW3cDocument(new W3CDom().fromJsoup(parsed), "/");
      builder.toStream(outputStream);
      builder.run();
      return outputStream.toByteArray();
    } catch (IOException e) {
      throw new RenderException("Failed to generate PDF from rendered HTML", e);
    }
  }

  private String cleanContent(String content) {
    if (content == null || content.isBlank()) {
      return "";
    }
    return Jsoup.clean(content, ENTRY_SAFELIST);
  }

  private String formatTimestamp(Long epochMillis) {
    if (epochMillis == null) {
      return "";
    }
    return ENTRY_DATE.format(Instant.ofEpochMilli(epochMillis).atZone(zoneId));
  }

  private static TemplateEngine createTemplateEngine() {
    ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
    resolver.setCacheable(true);
    TemplateEngine engine = new TemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
