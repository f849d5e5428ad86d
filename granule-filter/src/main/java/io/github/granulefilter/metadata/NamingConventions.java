package io.github.granulefilter.metadata;

/**
 * Sentinel-2 Level-1C file naming rules used to locate metadata documents.
 *
 * <p>Every method is a pure string transform so each rule can be checked against literal
 * product names.
 */
public final class NamingConventions {

  /**
   * Member name token of the product metadata in newer products.
   */
  public static final String PRODUCT_METADATA_TOKEN = "MTD_MSIL1C.xml";

  /**
   * Member name token of the granule metadata in newer products.
   */
  public static final String GRANULE_METADATA_TOKEN = "MTD_TL.xml";

  /**
   * Directory holding one sub-directory per granule.
   */
  public static final String GRANULE_DIRECTORY = "GRANULE";

  private static final String PRODUCT_TYPE = "PRD_MSIL1C";
  private static final String PRODUCT_METADATA_TYPE = "MTD_SAFL1C";
  private static final String IMAGE_TYPE = "MSI";
  private static final String METADATA_TYPE = "MTD";
  private static final String BASELINE_SUFFIX_PREFIX = "_N";
  private static final int BASELINE_SUFFIX_LENGTH = "_N02.01".length();

  private NamingConventions() {
  }

  /**
   * Expected product metadata file name for an archive that predates {@link
   * #PRODUCT_METADATA_TOKEN}.
   *
   * <p>{@code S2A_OPER_PRD_MSIL1C_PDMC_..._V2016.zip} becomes
   * {@code S2A_OPER_MTD_SAFL1C_PDMC_..._V2016.xml}. The same rule maps an expanded
   * {@code .SAFE} directory name.
   *
   * @param archiveName base name of the archive or product directory
   * @return the substring to search archive members for
   */
  public static String productMetadataPattern(final String archiveName) {
    return replaceExtension(archiveName.replace(PRODUCT_TYPE, PRODUCT_METADATA_TYPE), ".xml");
  }

  /**
   * Expected granule metadata file name inside a compressed archive.
   *
   * <p>{@code S2A_OPER_MSI_L1C_TL_SGS__20160101T012345_A002758_T55HFA_N02.01} with baseline
   * {@code 02.01} becomes {@code S2A_OPER_MTD_L1C_TL_SGS__20160101T012345_A002758_T55HFA.xml}.
   *
   * @param granuleId          the granule identifier
   * @param processingBaseline the product's processing baseline
   * @return the substring to search archive members for
   */
  public static String granuleMetadataPattern(
      final String granuleId, final String processingBaseline) {
    return granuleId
        .replace(IMAGE_TYPE, METADATA_TYPE)
        .replace(BASELINE_SUFFIX_PREFIX + processingBaseline, ".xml");
  }

  /**
   * Relative path of the granule metadata in an expanded product.
   *
   * @param granuleId the granule identifier
   * @return {@code GRANULE/<granuleId>/<granuleId without baseline suffix, MSI to MTD>.xml}
   */
  public static String granuleMetadataPath(final String granuleId) {
    if (granuleId.length() <= BASELINE_SUFFIX_LENGTH) {
      throw new IllegalArgumentException("Granule identifier too short: " + granuleId);
    }
    final String stem = granuleId.substring(0, granuleId.length() - BASELINE_SUFFIX_LENGTH);
    return GRANULE_DIRECTORY + "/" + granuleId + "/" + stem.replace(IMAGE_TYPE, METADATA_TYPE)
        + ".xml";
  }

  /**
   * Tile code of a granule: the second-to-last underscore-delimited token.
   *
   * @param granuleId the granule identifier
   * @return the tile code, e.g. {@code T55HFA}
   * @throws IllegalArgumentException if the identifier has fewer than two tokens
   */
  public static String tileCode(final String granuleId) {
    final String[] tokens = granuleId.split("_", -1);
    if (tokens.length < 2) {
      throw new IllegalArgumentException("Granule identifier has no tile code: " + granuleId);
    }
    return tokens[tokens.length - 2];
  }

  /**
   * Whether the tile code can be derived from the identifier.
   *
   * @param granuleId the granule identifier
   * @return true if {@link #tileCode(String)} succeeds
   */
  public static boolean hasTileCode(final String granuleId) {
    return granuleId.indexOf('_') >= 0;
  }

  private static String replaceExtension(final String name, final String extension) {
    final int dot = name.lastIndexOf('.');
    return (dot < 0 ? name : name.substring(0, dot)) + extension;
  }
}
