package storedb;

import java.util.Map;

/**
 * Server metadata for diagnostics and usage reporting.
 */
public interface MetadataSource {

  /**
   * Collects what is available. Sub-queries that fail are left out of the result; this
   * method never fails because of them.
   */
  Map<String, String> metadata();
}
