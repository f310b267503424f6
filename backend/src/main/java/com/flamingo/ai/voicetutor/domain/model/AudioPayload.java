package com.flamingo.ai.voicetutor.domain.model;

/**
 * Raw audio uploaded with a voice question.
 *
 * @param data audio bytes as received, may be {@code null} when no file was attached
 * @param declaredSize size reported by the multipart part, in bytes
 * @param contentType declared MIME type
 * @param fileName original file name
 */
public record AudioPayload(byte[] data, long declaredSize, String contentType, String fileName) {

  private static final String DEFAULT_FILE_NAME = "audio.webm";
  private static final String DEFAULT_CONTENT_TYPE = "audio/webm";

  public AudioPayload {
    if (fileName == null || fileName.isBlank()) {
      fileName = DEFAULT_FILE_NAME;
    }
    if (contentType == null || contentType.isBlank()) {
      contentType = DEFAULT_CONTENT_TYPE;
    }
  }

  public static AudioPayload of(byte[] data, String contentType, String fileName) {
    return new AudioPayload(data, data == null ? 0 : data.length, contentType, fileName);
  }

  public boolean isPresent() {
    return data != null;
  }

  /** Byte length, taking the larger of the declared and actual size. */
  public long size() {
    long actual = data == null ? 0 : data.length;
    return Math.max(actual, declaredSize);
  }
}
