package net.storyframe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the storyframe scene alignment service.
 */
@SpringBootApplication
public class StoryframeApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoryframeApplication.class, args);
    }
}
