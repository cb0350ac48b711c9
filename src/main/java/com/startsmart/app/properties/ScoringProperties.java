package com.startsmart.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {
    private double weightRule = 0.65;
    private double weightContextual = 0.35;
    private List<String> categories = new ArrayList<>(List.of("gym", "cafe"));
}
