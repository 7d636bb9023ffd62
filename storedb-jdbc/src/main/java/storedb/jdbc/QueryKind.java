package storedb.jdbc;

/**
 * Query primitives, labelled as they appear in the {@code type} log field and metric tag.
 */
public enum QueryKind {
  GET("get"),
  SELECT("select"),
  QUERY("start query"),
  EXEC("exec");

  private final String label;

  QueryKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
