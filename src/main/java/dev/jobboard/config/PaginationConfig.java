package dev.jobboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

/**
 * Default and maximum page sizes for list endpoints.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pagination")
public class PaginationConfig {

    private int defaultSize = 20;
    private int maxSize = 100;

    /**
     * Build a page request, falling back to the default size and capping at the maximum.
     */
    public Pageable pageable(Integer page, Integer size) {
        int safePage = page == null || page < 0 ? 0 : page;
        int requested = size == null || size <= 0 ? defaultSize : size;
        return PageRequest.of(safePage, Math.min(requested, maxSize));
    }
}
