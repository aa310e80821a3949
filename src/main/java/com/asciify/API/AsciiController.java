package com.asciify.API;

import com.asciify.pipeline.RenderConfig;
import com.asciify.pipeline.RenderException;
import com.asciify.sampler.ImageLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*") // the demo page may be opened from anywhere
public class AsciiController {

    @Autowired
    private RenderService renderService;

    @Autowired
    private ImageUploadService imageUploadService;

    @PostMapping(value = "/ascii", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> renderUpload(
            @RequestParam("image") MultipartFile image,
            @ModelAttribute RenderOptions options) {
        try {
            RenderConfig config = renderService.resolveConfig(options);
            byte[] bytes = imageUploadService.readImage(image);
            return ResponseEntity.ok().body(toResponse(renderService.renderUpload(bytes, config)));
        } catch (RenderException | InvalidUploadException e) {
            return badRequest(e);
        } catch (ImageLoadException e) {
            return unprocessable(e);
        } catch (Exception e) {
            return internalError(e);
        }
    }

    @GetMapping("/ascii")
    public ResponseEntity<?> renderUrl(
            @RequestParam("url") String url,
            @ModelAttribute RenderOptions options) {
        try {
            if (url.isBlank()) {
                return badRequest(new InvalidUploadException("No image URL given"));
            }
            RenderConfig config = renderService.resolveConfig(options);
            return ResponseEntity.ok().body(toResponse(renderService.renderUrl(url, config)));
        } catch (RenderException | InvalidUploadException e) {
            return badRequest(e);
        } catch (ImageLoadException e) {
            return unprocessable(e);
        } catch (Exception e) {
            return internalError(e);
        }
    }

    private static Map<String, Object> toResponse(RenderResult result) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("width", result.getGrid().getWidth());
        response.put("height", result.getGrid().getHeight());
        response.put("text", result.getText());
        if (result.getHtml() != null) {
            response.put("html", result.getHtml());
        }
        return response;
    }

    private static ResponseEntity<Map<String, String>> badRequest(Exception e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    private static ResponseEntity<Map<String, String>> unprocessable(ImageLoadException e) {
        log.warn("Could not load image: {}", e.getMessage());
        return ResponseEntity.unprocessableEntity().body(error(e.getMessage()));
    }

    private static ResponseEntity<Map<String, String>> internalError(Exception e) {
        log.error("Rendering failed", e);
        return ResponseEntity.internalServerError().body(error("Error: " + e.getMessage()));
    }

    private static Map<String, String> error(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return error;
    }
}
