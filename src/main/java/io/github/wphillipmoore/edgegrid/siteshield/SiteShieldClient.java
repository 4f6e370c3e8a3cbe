package io.github.wphillipmoore.edgegrid.siteshield;

import io.github.wphillipmoore.edgegrid.ApiRequest;
import io.github.wphillipmoore.edgegrid.ApiResponse;
import io.github.wphillipmoore.edgegrid.EdgeGridSession;
import io.github.wphillipmoore.edgegrid.RequestContext;
import io.github.wphillipmoore.edgegrid.exception.ApiException;
import java.util.Objects;

/** Site Shield map operations. Any status other than 200 is thrown as an {@link ApiException}. */
public final class SiteShieldClient {

  static final String GET_MAPS = "fetching site shield maps";
  static final String GET_MAP = "fetching site shield map";
  static final String ACK_MAP = "acknowledging site shield map";

  private static final String MAPS_PATH = "/siteshield/v1/maps";

  private final EdgeGridSession session;

  /**
   * Creates a client.
   *
   * @param session the session executing the calls
   */
  public SiteShieldClient(EdgeGridSession session) {
    this.session = Objects.requireNonNull(session, "session");
  }

  /** Lists all Site Shield maps. */
  public GetSiteShieldMapsResponse getSiteShieldMaps() {
    return getSiteShieldMaps(RequestContext.background());
  }

  /** Lists all Site Shield maps. */
  public GetSiteShieldMapsResponse getSiteShieldMaps(RequestContext context) {
    session.log(context).debug("GetSiteShieldMaps");
    ApiResponse<GetSiteShieldMapsResponse> response =
        session.exec(ApiRequest.get(MAPS_PATH), context, GetSiteShieldMapsResponse.class);
    return expectOk(GET_MAPS, response);
  }

  /** Fetches one Site Shield map. */
  public SiteShieldMap getSiteShieldMap(SiteShieldMapRequest params) {
    return getSiteShieldMap(RequestContext.background(), params);
  }

  /** Fetches one Site Shield map. */
  public SiteShieldMap getSiteShieldMap(RequestContext context, SiteShieldMapRequest params) {
    params.validateOrThrow(GET_MAP);
    session.log(context).debug("GetSiteShieldMap");
    ApiResponse<SiteShieldMap> response =
        session.exec(
            ApiRequest.get(MAPS_PATH + "/" + params.uniqueId()), context, SiteShieldMap.class);
    return expectOk(GET_MAP, response);
  }

  /** Acknowledges the proposed CIDRs of a Site Shield map. */
  public SiteShieldMap ackSiteShieldMap(SiteShieldMapRequest params) {
    return ackSiteShieldMap(RequestContext.background(), params);
  }

  /** Acknowledges the proposed CIDRs of a Site Shield map. */
  public SiteShieldMap ackSiteShieldMap(RequestContext context, SiteShieldMapRequest params) {
    params.validateOrThrow(ACK_MAP);
    session.log(context).debug("AckSiteShieldMap");
    ApiResponse<SiteShieldMap> response =
        session.exec(
            ApiRequest.post(MAPS_PATH + "/" + params.uniqueId() + "/acknowledge"),
            context,
            SiteShieldMap.class,
            params);
    return expectOk(ACK_MAP, response);
  }

  private static <T> T expectOk(String operation, ApiResponse<T> response) {
    if (response.statusCode() != 200) {
      throw ApiException.fromResponse(operation, response.body(), response.statusCode());
    }
    return Objects.requireNonNull(response.value(), "decoded response");
  }
}
