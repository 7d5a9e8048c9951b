package io.kudos.util;

import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec} for flat string-to-string objects.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> fields) {
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    if (fields != null) {
      boolean first = true;
      for (Map.Entry<String, String> entry : fields.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("fields cannot contain null keys");
        }
        if (entry.getValue() == null) {
          continue;
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(entry.getKey())).append('"').append(':');
        sb.append('"').append(escape(entry.getValue())).append('"');
      }
    }
    sb.append('}');
    return sb.toString();
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }
}
