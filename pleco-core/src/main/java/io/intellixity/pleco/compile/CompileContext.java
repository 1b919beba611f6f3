package io.intellixity.pleco.compile;

/**
 * State of a single filter compilation: hands out subquery aliases that are unique within the compiled
 * statement, so one virtual field can be referenced at several positions of a tree.
 */
final class CompileContext {
  private int next;

  String nextAlias(String field) {
    StringBuilder sb = new StringBuilder("subquery_");
    for (int i = 0; i < field.length(); i++) {
      char c = field.charAt(i);
      boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
      sb.append(ok ? c : '_');
    }
    return sb.append("__").append(++next).toString();
  }

  int aliasCount() {
    return next;
  }
}
