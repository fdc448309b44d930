package com.oilresource.oil.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "oil.api")
@Validated
public record OilApiProperties(@NotBlank String projectName, @NotBlank String version) {

  public OilApiProperties {
    projectName = projectName == null || projectName.isBlank() ? "Oil API" : projectName;
    version = version == null || version.isBlank() ? "1.0.0" : version;
  }
}
