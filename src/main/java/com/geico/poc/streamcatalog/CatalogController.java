package com.geico.poc.streamcatalog;

import com.geico.poc.streamcatalog.catalog.ObjectKind;
import com.geico.poc.streamcatalog.config.StreamCatalogConfig;
import com.geico.poc.streamcatalog.dto.CatalogResponse;
import com.geico.poc.streamcatalog.error.CatalogException;
import com.geico.poc.streamcatalog.manager.CatalogManager;
import com.geico.poc.streamcatalog.manager.CatalogSnapshot;
import com.geico.poc.streamcatalog.notification.CatalogNotification;
import com.geico.poc.streamcatalog.notification.NotificationBroadcaster;
import com.geico.poc.streamcatalog.notification.SubscriptionLaggedException;
import com.geico.poc.streamcatalog.show.ShowCatalogHandler;
import com.geico.poc.streamcatalog.show.ShowObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    private static final Logger log = LoggerFactory.getLogger(CatalogController.class);

    @Autowired
    private CatalogManager catalogManager;

    @Autowired
    private ShowCatalogHandler showCatalogHandler;

    @Autowired
    private NotificationBroadcaster broadcaster;

    @Autowired
    private StreamCatalogConfig config;

    @GetMapping("/snapshot")
    public ResponseEntity<Map<String, Object>> snapshot() {
        CatalogSnapshot snapshot = catalogManager.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", snapshot.getVersion());
        body.put("objects", snapshot.allObjects());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/show/{object}")
    public ResponseEntity<CatalogResponse> show(@PathVariable("object") String object,
                                                @RequestParam(value = "database", required = false) String database,
                                                @RequestParam(value = "schema", required = false) String schema,
                                                @RequestParam(value = "like", required = false) String pattern) {
        try {
            return ResponseEntity.ok(showCatalogHandler.show(ShowObject.parse(object), database, schema, pattern));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/columns/{relation}")
    public ResponseEntity<CatalogResponse> showColumns(@PathVariable("relation") String relation,
                                                       @RequestParam(value = "database", required = false) String database,
                                                       @RequestParam(value = "schema", required = false) String schema) {
        try {
            return ResponseEntity.ok(showCatalogHandler.showColumns(database, schema, relation));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/show-create/{kind}/{name}")
    public ResponseEntity<CatalogResponse> showCreate(@PathVariable("kind") String kind,
                                                      @PathVariable("name") String name,
                                                      @RequestParam(value = "database", required = false) String database,
                                                      @RequestParam(value = "schema", required = false) String schema) {
        try {
            ObjectKind objectKind = ObjectKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
            return ResponseEntity.ok(showCatalogHandler.showCreate(objectKind, database, schema, name));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    /**
     * Long-poll for every notification after {@code fromVersion}. Returns an empty list when
     * nothing was committed within the wait.
     */
    @GetMapping("/notifications")
    public ResponseEntity<?> notifications(@RequestParam("fromVersion") long fromVersion,
                                           @RequestParam(value = "waitMs", defaultValue = "0") long waitMs) {
        long wait = Math.max(0, Math.min(waitMs, config.getNotification().getMaxPollWaitMs()));
        try {
            List<CatalogNotification> notifications = broadcaster.awaitNotificationsSince(fromVersion, wait);
            return ResponseEntity.ok(notifications);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(CatalogResponse.error("Interrupted while waiting for notifications"));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static ResponseEntity<CatalogResponse> errorResponse(Exception e) {
        if (e instanceof CatalogException) {
            CatalogException ce = (CatalogException) e;
            return ResponseEntity.status(statusFor(ce.getErrorKind()))
                    .body(CatalogResponse.error(ce.getErrorKind().name(), e.getMessage()));
        }
        if (e instanceof SubscriptionLaggedException) {
            return ResponseEntity.status(HttpStatus.GONE).body(CatalogResponse.error(e.getMessage()));
        }
        if (e instanceof IllegalArgumentException) {
            return ResponseEntity.badRequest().body(CatalogResponse.error(e.getMessage()));
        }
        log.error("Catalog request failed", e);
        return ResponseEntity.internalServerError().body(CatalogResponse.error(e.getMessage()));
    }

    private static HttpStatus statusFor(CatalogException.ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case NAME_CONFLICT:
            case DEPENDENCY_VIOLATION:
            case VERSION_CONFLICT:
                return HttpStatus.CONFLICT;
            case STORE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case INCONSISTENT:
                return HttpStatus.INTERNAL_SERVER_ERROR;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }
}
