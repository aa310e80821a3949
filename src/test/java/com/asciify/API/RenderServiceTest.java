package com.asciify.API;

import com.asciify.pipeline.PixelBuffer;
import com.asciify.pipeline.RenderConfig;
import com.asciify.pipeline.RenderPipeline;
import com.asciify.presentation.HtmlPresenter;
import com.asciify.presentation.PlainTextPresenter;
import com.asciify.sampler.ImageLoadException;
import com.asciify.sampler.OpenCvImageSampler;
import com.asciify.sampler.PictureImageSampler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RenderServiceTest {
    private static final PixelBuffer WHITE_BLACK =
            PixelBuffer.fromUnsigned(2, 1, new int[]{255, 255, 255, 255, 0, 0, 0, 255});

    private OpenCvImageSampler uploadSampler;
    private PictureImageSampler urlSampler;
    private RenderService service;

    @BeforeEach
    void setUp() {
        uploadSampler = mock(OpenCvImageSampler.class);
        urlSampler = mock(PictureImageSampler.class);
        service = new RenderService(new RenderPipeline(), uploadSampler, urlSampler,
                new PlainTextPresenter(), new HtmlPresenter(), new AsciifyProperties());
    }

    @Test
    void rendersUploadAsText() throws Exception {
        when(uploadSampler.sample(any(byte[].class), eq(2))).thenReturn(WHITE_BLACK);

        RenderResult result = service.renderUpload(new byte[]{1}, RenderConfig.builder().width(2).charSet("@ ").build());

        assertEquals("@ \n", result.getText());
        assertNull(result.getHtml());
        assertEquals(2, result.getGrid().getWidth());
    }

    @Test
    void colorModeAddsHtml() throws Exception {
        when(urlSampler.sample(eq("http://example.com/a.png"), anyInt())).thenReturn(WHITE_BLACK);

        RenderResult result = service.renderUrl("http://example.com/a.png",
                RenderConfig.builder().width(2).charSet("@ ").colorMode(true).build());

        assertEquals("@ \n", result.getText());
        assertNotNull(result.getHtml());
        assertTrue(result.getHtml().contains("color:rgb(255,255,255)"));
    }

    @Test
    void loadFailuresPropagate() throws Exception {
        when(urlSampler.sample(any(String.class), anyInt())).thenThrow(new ImageLoadException("boom"));
        assertThrows(ImageLoadException.class, () -> service.renderUrl("https://example.com/missing.png", RenderConfig.defaults()));
    }

    @Test
    void onlyRemoteHttpUrlsAreFetched() throws Exception {
        for (String location : new String[]{"/etc/passwd", "file:///etc/passwd", "classpath:application.properties",
                "ftp://example.com/cat.png", "https:/cat.png", "C:\\images\\cat.png", "not a url"}) {
            assertThrows(InvalidUploadException.class, () -> service.renderUrl(location, RenderConfig.defaults()),
                    location);
        }
        verify(urlSampler, never()).sample(any(String.class), anyInt());

        when(urlSampler.sample(any(String.class), anyInt()))
                .thenReturn(PixelBuffer.filled(1, 1, 0, 0, 0, 255));
        service.renderUrl("HTTP://example.com/cat.png", RenderConfig.defaults());
        verify(urlSampler).sample(eq("HTTP://example.com/cat.png"), anyInt());
    }

    @Test
    void resolvesMissingOptionsToDefaults() {
        RenderConfig config = service.resolveConfig(null);
        assertEquals(new AsciifyProperties().getDefaultWidth(), config.getWidth());
    }
}
