package shepherd.util.strings;

import java.util.regex.Pattern;

public class MoreStrings {
  private static final Pattern TRAILING_LINE_BREAKS = Pattern.compile("[\\r\\n]+$");

  public static String padLeft(String str, int requiredWidth, char padChar) {
    if (str.length() >= requiredWidth) return str;
    StringBuilder builder = new StringBuilder(requiredWidth);
    for (int i = str.length(); i < requiredWidth; i++) {
      builder.append(padChar);
    }
    return builder.append(str).toString();
  }

  /**
   * Cuts the string at {@code maxLen} characters, with no marker.
   */
  public static String clip(String str, int maxLen) {
    return str.length() <= maxLen ? str : str.substring(0, maxLen);
  }

  public static String stripTrailingLineBreaks(String str) {
    return TRAILING_LINE_BREAKS.matcher(str).replaceFirst("");
  }
}
