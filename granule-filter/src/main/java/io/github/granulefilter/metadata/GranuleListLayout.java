package io.github.granulefilter.metadata;

/**
 * Where the granule list lives in the product metadata. Tried in declaration order.
 */
public enum GranuleListLayout {
  /**
   * Older multi-granule products: {@code Granule_List/Granules}.
   */
  GRANULES("Granules"),

  /**
   * Newer products: {@code Granule_List/Granule}.
   */
  GRANULE("Granule");

  private static final String GRANULE_LIST = "/*/*/Product_Info/Product_Organisation/Granule_List/";

  private final String element;

  GranuleListLayout(final String element) {
    this.element = element;
  }

  /**
   * XPath selecting the granule elements of this layout.
   *
   * @return the expression
   */
  public String expression() {
    return GRANULE_LIST + element;
  }
}
