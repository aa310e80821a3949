package com.asciify.API;

import com.asciify.pipeline.RenderPipeline;
import com.asciify.presentation.HtmlPresenter;
import com.asciify.presentation.PlainTextPresenter;
import com.asciify.sampler.OpenCvImageSampler;
import com.asciify.sampler.PictureImageSampler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AsciifyConfiguration {

    @Bean
    public RenderPipeline renderPipeline() {
        return new RenderPipeline();
    }

    @Bean
    public OpenCvImageSampler openCvImageSampler(AsciifyProperties properties) {
        return new OpenCvImageSampler(properties.getCharAspect());
    }

    @Bean
    public PictureImageSampler pictureImageSampler(AsciifyProperties properties) {
        return new PictureImageSampler(properties.getCharAspect());
    }

    @Bean
    public PlainTextPresenter plainTextPresenter() {
        return new PlainTextPresenter();
    }

    @Bean
    public HtmlPresenter htmlPresenter() {
        return new HtmlPresenter();
    }
}
