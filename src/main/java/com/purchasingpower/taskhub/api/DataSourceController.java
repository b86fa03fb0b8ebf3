package com.purchasingpower.taskhub.api;

import com.purchasingpower.taskhub.routing.DataSourceRouter;
import com.purchasingpower.taskhub.routing.RouterStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of the storage sources.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/data-sources")
@RequiredArgsConstructor
public class DataSourceController {

    private final DataSourceRouter router;

    /**
     * GET /api/v1/data-sources/status
     */
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<RouterStatus>> status() {
        try {
            return ResponseEntity.ok(ApiResponse.success(router.getStatus()));
        } catch (Exception e) {
            return ErrorResponses.from("Data source status", e);
        }
    }

    /**
     * Run a health check on every source now and return the resulting status.
     *
     * POST /api/v1/data-sources/health-check
     */
    @PostMapping("/health-check")
    public ResponseEntity<ApiResponse<RouterStatus>> checkHealth() {
        try {
            router.checkHealth().join();
            RouterStatus status = router.getStatus();
            log.info("Health check complete: healthy={}, total={}", status.healthy(), status.total());
            return ResponseEntity.ok(ApiResponse.success(status));
        } catch (Exception e) {
            return ErrorResponses.from("Health check", e);
        }
    }
}
