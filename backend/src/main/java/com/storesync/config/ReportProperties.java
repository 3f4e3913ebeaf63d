package com.storesync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storesync.reports")
@NoArgsConstructor
@Getter
@Setter
public class ReportProperties {

    /** Save a JSON report after each deploy. Default true. */
    private boolean enabled = true;

    /** Directory for deployment reports. Default .storesync/reports. */
    private String directory = ".storesync/reports";

    /** Reports kept; older ones are deleted. Default 10. */
    private int maxReports = 10;
}
