package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.ApiRequest;
import io.github.wphillipmoore.edgegrid.ApiResponse;
import io.github.wphillipmoore.edgegrid.EdgeGridSession;
import io.github.wphillipmoore.edgegrid.RequestContext;
import io.github.wphillipmoore.edgegrid.exception.ApiException;
import io.github.wphillipmoore.edgegrid.exception.RequestCreationException;
import java.util.Objects;

/**
 * Property Manager (PAPI) operations: rule trees, rule formats and property search.
 *
 * <p>Every request carries the {@code PAPI-Use-Prefixes} header. Any status other than 200 is
 * thrown as an {@link ApiException} whose message starts with the failing operation, e.g. {@code
 * fetching rule tree: API error: ...}. Invalid parameters are rejected with a {@link
 * io.github.wphillipmoore.edgegrid.exception.ValidationException} before anything is sent.
 */
public final class PapiClient {

  static final String USE_PREFIXES_HEADER = "PAPI-Use-Prefixes";

  static final String GET_RULE_TREE = "fetching rule tree";
  static final String UPDATE_RULE_TREE = "updating rule tree";
  static final String GET_RULE_FORMATS = "fetching rule formats";
  static final String SEARCH_PROPERTIES = "searching properties";

  private final EdgeGridSession session;
  private final boolean usePrefixes;

  /**
   * Creates a client that asks for prefixed IDs ({@code prp_}, {@code ctr_}, ...).
   *
   * @param session the session executing the calls
   */
  public PapiClient(EdgeGridSession session) {
    this(session, true);
  }

  /**
   * Creates a client.
   *
   * @param session the session executing the calls
   * @param usePrefixes whether IDs in requests and responses carry type prefixes
   */
  public PapiClient(EdgeGridSession session, boolean usePrefixes) {
    this.session = Objects.requireNonNull(session, "session");
    this.usePrefixes = usePrefixes;
  }

  /** Fetches a property version's rule tree. */
  public GetRuleTreeResponse getRuleTree(GetRuleTreeRequest params) {
    return getRuleTree(RequestContext.background(), params);
  }

  /**
   * Fetches a property version's rule tree.
   *
   * @param context the call context
   * @param params the request parameters
   * @return the rule tree
   */
  public GetRuleTreeResponse getRuleTree(RequestContext context, GetRuleTreeRequest params) {
    params.validateOrThrow(GET_RULE_TREE);
    session.log(context).debug("GetRuleTree");

    ApiRequest request =
        ApiRequest.get(rulesPath(params.propertyId(), params.propertyVersion()))
            .withQuery("contractId", params.contractId())
            .withQuery("groupId", params.groupId());
    if (!params.validateMode().isEmpty()) {
      request = request.withQuery("validateMode", params.validateMode());
    }
    if (!params.validateRules()) {
      request = request.withQuery("validateRules", "false");
    }
    if (!params.ruleFormat().isEmpty()) {
      request =
          request.withHeader(
              "Accept", "application/vnd.akamai.papirules." + params.ruleFormat() + "+json");
    }
    return expectOk(
        GET_RULE_TREE, exec(GET_RULE_TREE, request, context, GetRuleTreeResponse.class));
  }

  /** Replaces a property version's rule tree. */
  public UpdateRulesResponse updateRuleTree(UpdateRulesRequest params) {
    return updateRuleTree(RequestContext.background(), params);
  }

  /**
   * Replaces a property version's rule tree.
   *
   * @param context the call context
   * @param params the request parameters and new tree
   * @return the saved tree with validation errors and warnings
   */
  public UpdateRulesResponse updateRuleTree(RequestContext context, UpdateRulesRequest params) {
    params.validateOrThrow(UPDATE_RULE_TREE);
    session.log(context).debug("UpdateRuleTree");

    ApiRequest request =
        ApiRequest.put(rulesPath(params.propertyId(), params.propertyVersion()))
            .withQuery("contractId", params.contractId())
            .withQuery("groupId", params.groupId());
    if (!params.validateMode().isEmpty()) {
      request = request.withQuery("validateMode", params.validateMode());
    }
    if (!params.validateRules()) {
      request = request.withQuery("validateRules", "false");
    }
    if (params.dryRun()) {
      request = request.withQuery("dryRun", "true");
    }
    return expectOk(
        UPDATE_RULE_TREE,
        exec(UPDATE_RULE_TREE, request, context, UpdateRulesResponse.class, params.rules()));
  }

  /** Lists the available rule formats. */
  public GetRuleFormatsResponse getRuleFormats() {
    return getRuleFormats(RequestContext.background());
  }

  /**
   * Lists the available rule formats.
   *
   * @param context the call context
   * @return the rule formats
   */
  public GetRuleFormatsResponse getRuleFormats(RequestContext context) {
    session.log(context).debug("GetRuleFormats");
    ApiRequest request = ApiRequest.get("/papi/v1/rule-formats");
    return expectOk(
        GET_RULE_FORMATS,
        exec(GET_RULE_FORMATS, request, context, GetRuleFormatsResponse.class));
  }

  /** Finds property versions by property name, hostname or edge hostname. */
  public SearchResponse searchProperties(SearchRequest params) {
    return searchProperties(RequestContext.background(), params);
  }

  /**
   * Finds property versions by property name, hostname or edge hostname.
   *
   * @param context the call context
   * @param params the search key and value
   * @return the matching property versions
   */
  public SearchResponse searchProperties(RequestContext context, SearchRequest params) {
    params.validateOrThrow(SEARCH_PROPERTIES);
    session.log(context).debug("SearchProperties");
    ApiRequest request = ApiRequest.post("/papi/v1/search/find-by-value");
    return expectOk(
        SEARCH_PROPERTIES,
        exec(SEARCH_PROPERTIES, request, context, SearchResponse.class, params.body()));
  }

  private <T> ApiResponse<T> exec(
      String operation,
      ApiRequest request,
      RequestContext context,
      Class<T> outputType,
      Object... body) {
    try {
      return session.exec(
          request.withHeader(USE_PREFIXES_HEADER, String.valueOf(usePrefixes)),
          context,
          outputType,
          body);
    } catch (RequestCreationException e) {
      throw new RequestCreationException(operation + ": " + e.getMessage(), e);
    }
  }

  static <T> T expectOk(String operation, ApiResponse<T> response) {
    if (response.statusCode() != 200) {
      throw ApiException.fromResponse(operation, response.body(), response.statusCode());
    }
    return Objects.requireNonNull(response.value(), "decoded response");
  }

  static String rulesPath(String propertyId, int propertyVersion) {
    return "/papi/v1/properties/"
        + ApiRequest.escapePathSegment(propertyId)
        + "/versions/"
        + propertyVersion
        + "/rules";
  }
}
