package ledgerlink.sheets.api.filters;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.ext.Provider;

/**
 * JAX-RS response filter that makes every response readable from the browser-based import UI.
 *
 * <p>
 * Adds permissive CORS headers to success, error and pre-flight responses alike. The UI is served from a different
 * origin than this service and sends {@code Authorization}, {@code Apikey} and {@code X-Client-Info} headers.
 */
@Provider
public class CorsResponseFilter implements ContainerResponseFilter {

    public static final String ALLOW_ORIGIN = "*";
    public static final String ALLOW_METHODS = "GET, POST, PUT, DELETE, OPTIONS";
    public static final String ALLOW_HEADERS = "Content-Type, Authorization, X-Client-Info, Apikey";

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        headers.putSingle("Access-Control-Allow-Origin", ALLOW_ORIGIN);
        headers.putSingle("Access-Control-Allow-Methods", ALLOW_METHODS);
        headers.putSingle("Access-Control-Allow-Headers", ALLOW_HEADERS);
    }
}
