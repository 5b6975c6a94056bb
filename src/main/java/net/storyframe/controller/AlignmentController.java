package net.storyframe.controller;

import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.util.List;
import java.util.Map;
import net.storyframe.application.alignment.SceneAlignmentService;
import net.storyframe.controller.dto.AlignmentDtoMapper;
import net.storyframe.controller.dto.AutoSyncQueueDto;
import net.storyframe.controller.dto.FindAlignedImagesRequest;
import net.storyframe.controller.dto.ImageMatchDto;
import net.storyframe.controller.support.ErrorResponseUtils;
import net.storyframe.domain.image.ImageMatch;
import net.storyframe.domain.scene.Scene;
import net.storyframe.support.sync.AutoSyncQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Scene-to-image alignment endpoints.
 */
@RestController
@RequestMapping("/api/alignment")
public class AlignmentController {

    private static final Logger log = LoggerFactory.getLogger(AlignmentController.class);

    private final SceneAlignmentService alignmentService;
    private final AutoSyncQueueService autoSyncQueueService;

    public AlignmentController(SceneAlignmentService alignmentService, AutoSyncQueueService autoSyncQueueService) {
        this.alignmentService = alignmentService;
        this.autoSyncQueueService = autoSyncQueueService;
    }

    /**
     * Returns one ranked image list per requested scene, in request order.
     */
    @PostMapping("/find-images")
    @RateLimiter(name = "alignmentRateLimiter")
    public ResponseEntity<List<List<ImageMatchDto>>> findImages(@RequestBody FindAlignedImagesRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        List<Scene> scenes = AlignmentDtoMapper.toScenes(request.scenes());
        int topK = request.topK() == null ? 0 : request.topK();
        double multiplier = request.moodConsistencyWeight() == null ? 1.0 : request.moodConsistencyWeight();

        List<List<ImageMatch>> matches = alignmentService.findAlignedImages(scenes, topK, multiplier);
        return ResponseEntity.ok(AlignmentDtoMapper.toDtos(matches));
    }

    /**
     * Returns the depth of the zero-match auto-sync queue.
     */
    @GetMapping("/auto-sync/queue")
    public ResponseEntity<AutoSyncQueueDto> autoSyncQueue() {
        AutoSyncQueueService.QueueSnapshot snapshot = autoSyncQueueService.snapshot();
        return ResponseEntity.ok(new AutoSyncQueueDto(snapshot.pending(), snapshot.enqueuedTotal()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException ex) {
        log.warn("Rejected alignment request: {}", ex.getMessage());
        return ErrorResponseUtils.badRequest("Invalid alignment request", ex.getMessage());
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<Map<String, String>> handleRateLimited(RequestNotPermitted ex) {
        log.warn("Alignment request rate limited: {}", ex.getMessage());
        return ErrorResponseUtils.tooManyRequests("Too many alignment requests", ex.getMessage());
    }
}
