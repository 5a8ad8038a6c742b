package habitkit;

/**
 * Named extra operation an extension exposes next to its hooks, such as a statistics
 * query. The host decides how endpoints are reached (the demo app maps them to HTTP).
 */
@FunctionalInterface
public interface Endpoint {

  Object invoke(EndpointRequest request) throws Exception;
}
