package com.williamcallahan.chatlatex.web;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.domain.latex.MathRenderRequest;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import com.williamcallahan.chatlatex.domain.math.MathCacheClearOutcome;
import com.williamcallahan.chatlatex.domain.math.MathSubstitutionRequest;
import com.williamcallahan.chatlatex.domain.math.MathSubstitutionResponse;
import com.williamcallahan.chatlatex.service.math.MathImageCache;
import com.williamcallahan.chatlatex.service.math.MathImageSubstitutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Optional;

/**
 * REST endpoints for formula bitmaps used by the live chat view.
 */
@RestController
@RequestMapping("/api/latex/math")
public class MathImageController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(MathImageController.class);

    private final MathImageCache mathImageCache;
    private final MathImageSubstitutionService substitutionService;
    private final int defaultDpi;

    public MathImageController(MathImageCache mathImageCache,
                               MathImageSubstitutionService substitutionService,
                               AppProperties appProperties,
                               ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.mathImageCache = mathImageCache;
        this.substitutionService = substitutionService;
        this.defaultDpi = appProperties.getMath().getDefaultDpi();
    }

    /**
     * Renders one formula.
     *
     * @param request expression, display flag, color and dpi
     * @return PNG bytes, or 422 whose details carry the literal expression to show instead
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> render(@RequestBody MathRenderRequest request) {
        if (request.expression().isBlank()) {
            return handleValidationException(new IllegalArgumentException("Expression must not be blank"));
        }
        int dpi = request.dpi() > 0 ? request.dpi() : defaultDpi;
        Optional<byte[]> png = mathImageCache.renderBytes(
            request.expression(), request.display(), RgbColor.parse(request.color()), dpi);
        if (png.isEmpty()) {
            return unprocessable("Formula could not be rendered", request.expression());
        }
        return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(png.get());
    }

    /**
     * Replaces the formulas of a display text with image tags.
     */
    @PostMapping(value = "/substitute",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> substitute(@RequestBody MathSubstitutionRequest request) {
        String substituted = substitutionService.substitute(request.text(), request.color(), request.dpi());
        return ResponseEntity.ok(new MathSubstitutionResponse(substituted));
    }

    /**
     * Reports hit/miss statistics of the formula cache.
     */
    @GetMapping(value = "/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> cacheStats() {
        return ResponseEntity.ok(mathImageCache.stats());
    }

    /**
     * Clears memory and disk tiers of the formula cache.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache() {
        try {
            MathCacheClearOutcome outcome = mathImageCache.clear();
            return createSuccessResponse("Formula cache cleared: " + outcome.memoryEntriesCleared()
                + " in memory, " + outcome.diskFilesDeleted() + " files");
        } catch (IOException clearFailure) {
            logger.error("Error clearing formula cache", clearFailure);
            return handleServiceException(clearFailure, "clear formula cache");
        }
    }
}
