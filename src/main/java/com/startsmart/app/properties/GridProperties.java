package com.startsmart.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "grid")
public class GridProperties {
    private double cellSizeM = 100.0;
    private List<String> regions = new ArrayList<>();
    private Map<String, Region> region = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Region {
        private double north;
        private double south;
        private double east;
        private double west;
        private Double cellSizeM;
    }
}
