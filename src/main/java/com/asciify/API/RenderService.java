package com.asciify.API;

import com.asciify.glyph.GlyphGrid;
import com.asciify.pipeline.PixelBuffer;
import com.asciify.pipeline.RenderConfig;
import com.asciify.pipeline.RenderPipeline;
import com.asciify.presentation.HtmlPresenter;
import com.asciify.presentation.PlainTextPresenter;
import com.asciify.sampler.ImageLoadException;
import com.asciify.sampler.OpenCvImageSampler;
import com.asciify.sampler.PictureImageSampler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;

@Slf4j
@Service
@RequiredArgsConstructor
public class RenderService {
    private final RenderPipeline renderPipeline;
    private final OpenCvImageSampler uploadSampler;
    private final PictureImageSampler urlSampler;
    private final PlainTextPresenter plainTextPresenter;
    private final HtmlPresenter htmlPresenter;
    private final AsciifyProperties properties;

    public RenderConfig resolveConfig(RenderOptions options) {
        return (options == null ? new RenderOptions() : options).toConfig(properties);
    }

    public RenderResult renderUpload(byte[] image, RenderConfig config) throws ImageLoadException {
        PixelBuffer sampled = uploadSampler.sample(image, config.getWidth());
        log.info("Sampled upload to {}x{}", sampled.getWidth(), sampled.getHeight());
        return render(sampled, config);
    }

    /**
     * Only absolute http(s) URLs are fetched; file paths, classpath resources and other schemes are rejected with
     * {@link InvalidUploadException}.
     */
    public RenderResult renderUrl(String url, RenderConfig config) throws ImageLoadException {
        checkRemoteUrl(url);
        PixelBuffer sampled = urlSampler.sample(url, config.getWidth());
        log.info("Sampled {} to {}x{}", url, sampled.getWidth(), sampled.getHeight());
        return render(sampled, config);
    }

    static void checkRemoteUrl(String url) {
        URI uri;
        try {
            uri = new URI(url == null ? "" : url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidUploadException("Not a valid image URL: " + url);
        }
        String scheme = uri.getScheme();
        if (!uri.isAbsolute() || uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            log.warn("Rejected image URL {}", url);
            throw new InvalidUploadException("Only http and https image URLs are accepted: " + url);
        }
    }

    private RenderResult render(PixelBuffer sampled, RenderConfig config) {
        GlyphGrid grid = renderPipeline.render(sampled, config);
        String text = plainTextPresenter.present(grid);
        String html = config.isColorMode() ? htmlPresenter.present(grid) : null;
        return new RenderResult(grid, text, html);
    }
}
