package io.intellixity.reportql.validate;

import java.util.regex.Pattern;

/** Lexical rules for anything spliced into SQL text as a name. */
public final class Identifiers {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern WORD = Pattern.compile("[A-Za-z0-9_]+");
  private static final Pattern TABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private Identifiers() {}

  public static boolean isIdentifier(String s) {
    return s != null && IDENT.matcher(s).matches();
  }

  /** Letters, digits and underscores only; may start with a digit. */
  public static boolean isWord(String s) {
    return s != null && WORD.matcher(s).matches();
  }

  /** Plain or schema-qualified ({@code schema.table}) name. */
  public static boolean isTableName(String s) {
    return s != null && TABLE.matcher(s).matches();
  }
}
