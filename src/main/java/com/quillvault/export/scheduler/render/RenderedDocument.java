package com.quillvault.export.scheduler.render;

public record RenderedDocument(byte[] content, String fileName, String contentType) {

  public int size() {
    return content.length;
  }
}
