package io.github.themoah.facetscope.model;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the facets investigated for every anomaly.
 */
public final class Breakdowns {

  public static final Breakdown HOSTS = Breakdown.of("breakdown-hosts", "`request.host`");
  public static final Breakdown FORWARDED_HOSTS =
    Breakdown.of("breakdown-forwarded-hosts", "`request.headers.x_forwarded_host`");
  public static final Breakdown CONTENT_TYPES =
    Breakdown.of("breakdown-content-types", "`response.headers.content_type`");
  public static final Breakdown ERRORS = Breakdown.of("breakdown-errors", "`response.headers.x_error`",
    "AND `response.headers.x_error` != ''");
  public static final Breakdown CACHE = Breakdown.of("breakdown-cache", "upper(`cdn.cache_status`)");
  public static final Breakdown PATHS = Breakdown.of("breakdown-paths", "`request.url`");
  public static final Breakdown USER_AGENTS =
    Breakdown.of("breakdown-user-agents", "`request.headers.user_agent`");
  public static final Breakdown IPS = Breakdown.of("breakdown-ips",
    "if(`request.headers.x_forwarded_for` != '', `request.headers.x_forwarded_for`, `client.ip`)");
  public static final Breakdown BACKEND_TYPE = Breakdown.of("breakdown-backend-type", "`helix.backend_type`",
    "AND `helix.backend_type` != ''");
  public static final Breakdown DATACENTERS = Breakdown.of("breakdown-datacenters", "`cdn.datacenter`");
  public static final Breakdown ASN = Breakdown.of("breakdown-asn",
    "concat(toString(`client.asn`), ' ', dictGet('helix_logs_production.asn_dict', 'name', `client.asn`))",
    "AND `client.asn` != 0");

  private static final List<Breakdown> INVESTIGATED = List.of(
    HOSTS, FORWARDED_HOSTS, PATHS, ERRORS, USER_AGENTS, IPS, ASN, DATACENTERS, CACHE, CONTENT_TYPES, BACKEND_TYPE
  );

  private Breakdowns() {}

  /**
   * Facets analyzed for each anomaly and selection.
   */
  public static List<Breakdown> investigated() {
    return INVESTIGATED;
  }

  public static Optional<Breakdown> byId(String id) {
    return INVESTIGATED.stream().filter(b -> b.id().equals(id)).findFirst();
  }
}
