package com.texturecritter.server.controller;

import com.texturecritter.image.ImageCodecException;
import com.texturecritter.server.service.SynthesisOutcome;
import com.texturecritter.server.service.TextureSynthesisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

@RestController
public class SynthesisController {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisController.class);
    private final TextureSynthesisService synthesisService;

    public SynthesisController(TextureSynthesisService synthesisService) {
        this.synthesisService = synthesisService;
    }

    @PostMapping(value = "/synthesize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> synthesize(@RequestParam("source") MultipartFile source,
            @RequestParam(value = "target", required = false) MultipartFile target,
            @RequestParam(value = "radius", required = false) Integer radius,
            @RequestParam(value = "scale", required = false) Integer scale) {
        if (source == null || source.isEmpty()) {
            return ResponseEntity.badRequest().body("Missing source image.");
        }

        logger.info("Received synthesis request: source={} ({} bytes), target={}", source.getOriginalFilename(),
                source.getSize(), target == null || target.isEmpty() ? "none" : target.getOriginalFilename());

        try {
            byte[] targetBytes = target == null || target.isEmpty() ? null : target.getBytes();
            SynthesisOutcome outcome = synthesisService.synthesize(source.getBytes(), targetBytes, radius, scale);
            return ResponseEntity.ok()
                    .contentType(mediaTypeFor(outcome.getFormat()))
                    .header("X-Synthesis-Complete", Boolean.toString(outcome.isComplete()))
                    .header("X-Synthesis-Millis", Long.toString(outcome.getElapsedMillis()))
                    .body(outcome.getImageBytes());
        } catch (ImageCodecException e) {
            logger.warn("Rejected synthesis request: {}", e.getMessage());
            return ResponseEntity.badRequest().body("Invalid image data: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to read upload", e);
            return ResponseEntity.internalServerError().body("Could not read upload.");
        }
    }

    private static MediaType mediaTypeFor(String format) {
        switch (format.toLowerCase(Locale.ROOT)) {
            case "png":
                return MediaType.IMAGE_PNG;
            case "jpg":
            case "jpeg":
                return MediaType.IMAGE_JPEG;
            case "gif":
                return MediaType.IMAGE_GIF;
            default:
                return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
