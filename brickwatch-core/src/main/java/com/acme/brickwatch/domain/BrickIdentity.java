package com.acme.brickwatch.domain;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.regex.Pattern;

/** Generation of public identifiers and slugs. */
public final class BrickIdentity {

  public static final int ID_LENGTH = 8;
  public static final Pattern ID_PATTERN = Pattern.compile("[a-z]{" + ID_LENGTH + "}");

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Pattern SEPARATORS = Pattern.compile("[-\\s_]+");
  private static final Pattern NON_WORD = Pattern.compile("[^-\\w]+", Pattern.UNICODE_CHARACTER_CLASS);

  private BrickIdentity() {}

  /** Eight random lowercase letters. */
  public static String newId() {
    char[] chars = new char[ID_LENGTH];
    for (int i = 0; i < ID_LENGTH; i++) {
      chars[i] = (char) ('a' + RANDOM.nextInt(26));
    }
    return new String(chars);
  }

  public static boolean isId(String candidate) {
    return candidate != null && ID_PATTERN.matcher(candidate).matches();
  }

  /**
   * Lowercases the name, collapses runs of dashes, whitespace and underscores into one dash and
   * strips everything else that is not a word character.
   */
  public static String slugify(String name) {
    String lowered = name.toLowerCase(Locale.ROOT);
    String dashed = SEPARATORS.matcher(lowered).replaceAll("-");
    return NON_WORD.matcher(dashed).replaceAll("");
  }
}
