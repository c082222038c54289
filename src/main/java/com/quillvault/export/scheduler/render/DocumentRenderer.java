package com.quillvault.export.scheduler.render;

import com.quillvault.export.scheduler.exception.RenderException;
import com.quillvault.export.scheduler.model.JournalEntry;
import java.util.List;

public interface DocumentRenderer {

  /**
   * Renders the entries, newest first, into a single document.
   *
   * @throws RenderException if the document cannot be produced; no partial output is returned
   */
  RenderedDocument render(String title, List<JournalEntry> entries);
}
