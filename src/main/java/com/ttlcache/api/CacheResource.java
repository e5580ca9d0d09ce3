package com.ttlcache.api;

import com.ttlcache.core.TtlCache;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.time.Duration;
import java.util.Objects;

/**
 * Uygulama içindeki önbelleği HTTP üzerinden okumak, süreli değer yazmak ve
 * kalan yaşam süresini sorgulamak için sağlanan REST kaynağıdır. Önbellek
 * geçersiz yazmaları sessizce yok saydığı için bu katman onları 400 ile
 * reddeder.
 */
@Path("/cache")
@ApplicationScoped
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class CacheResource {

    private final TtlCache<Object> cache;

    @Inject
    public CacheResource(TtlCache<Object> cache) {
        this.cache = cache;
    }

    @GET
    public SizeView size() {
        return new SizeView(cache.len());
    }

    @GET
    @Path("{key}")
    public Response get(@PathParam("key") String key) {
        Object value = cache.get(key);
        if (value == null) {
            return notFound();
        }
        return Response.ok(new EntryView(key, value)).build();
    }

    @GET
    @Path("{key}/ttl")
    public Response ttl(@PathParam("key") String key) {
        Duration ttl = cache.ttl(key);
        if (ttl.isNegative()) {
            return notFound();
        }
        return Response.ok(new TtlView(key, ttl.toMillis())).build();
    }

    @PUT
    @Path("{key}")
    public Response put(@PathParam("key") String key, CacheWriteRequest request) {
        if (request == null || request.value() == null || request.value().isEmpty()) {
            return badRequest("value must be provided");
        }
        if (request.ttlMillis() == null || request.ttlMillis() <= 0) {
            return badRequest("ttlMillis must be positive");
        }
        cache.setEx(key, request.value(), Duration.ofMillis(request.ttlMillis()));
        return Response.noContent().build();
    }

    private static Response notFound() {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse("Key not found"))
                .build();
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse(message))
                .build();
    }

    public record EntryView(String key, Object value) {}

    public record TtlView(String key, long ttlMillis) {}

    public record SizeView(int size) {}

    public record ErrorResponse(String message) {}

    public static final class CacheWriteRequest {
        private String value;
        private Long ttlMillis;

        public CacheWriteRequest() {
        }

        public CacheWriteRequest(String value, Long ttlMillis) {
            this.value = value;
            this.ttlMillis = ttlMillis;
        }

        public String value() {
            return value;
        }

        public Long ttlMillis() {
            return ttlMillis;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public void setTtlMillis(Long ttlMillis) {
            this.ttlMillis = ttlMillis;
        }

        @Override
        public String toString() {
            return "CacheWriteRequest{" +
                    "value='" + value + '\'' +
                    ", ttlMillis=" + ttlMillis +
                    '}';
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, ttlMillis);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CacheWriteRequest that = (CacheWriteRequest) o;
            return Objects.equals(value, that.value) && Objects.equals(ttlMillis, that.ttlMillis);
        }
    }
}
