package io.github.wphillipmoore.edgegrid.siteshield;

import java.util.List;

/**
 * All Site Shield maps of the account.
 *
 * @param siteShieldMaps the maps
 */
public record GetSiteShieldMapsResponse(List<SiteShieldMap> siteShieldMaps) {}
