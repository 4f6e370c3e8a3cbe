package io.github.wphillipmoore.edgegrid.papi;

import java.util.List;

/**
 * Property versions matching a search.
 *
 * @param versions the matching versions
 */
public record SearchResponse(SearchItems versions) {

  /**
   * Wrapper of the match list.
   *
   * @param items the matching versions
   */
  public record SearchItems(List<SearchItem> items) {}

  /**
   * One matching property version.
   *
   * @param accountId the account ID
   * @param assetId the asset ID
   * @param contractId the contract ID
   * @param edgeHostname the matched edge hostname, if searched by it
   * @param groupId the group ID
   * @param hostname the matched hostname, if searched by it
   * @param productionStatus activation status on production
   * @param propertyId the property ID
   * @param propertyName the property name
   * @param propertyVersion the property version
   * @param stagingStatus activation status on staging
   * @param updatedByUser who last updated the version
   * @param updatedDate when the version was last updated
   */
  public record SearchItem(
      String accountId,
      String assetId,
      String contractId,
      String edgeHostname,
      String groupId,
      String hostname,
      String productionStatus,
      String propertyId,
      String propertyName,
      int propertyVersion,
      String stagingStatus,
      String updatedByUser,
      String updatedDate) {}
}
