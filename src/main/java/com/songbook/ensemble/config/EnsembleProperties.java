package com.songbook.ensemble.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.ensemble")
public record EnsembleProperties(
	@NotNull @Min(1) @Max(500) Integer topKPerSource,
	@NotNull @Min(1) @Max(500) Integer topKFinal,
	@NotNull Duration sourceTimeout,
	@NotNull Duration deadlineGrace,
	@NotNull Duration maxDeadline,
	@NotNull Boolean failFast,
	@NotNull @Min(1) @Max(64) Integer maxSources,
	List<@Valid Source> sources
) {

	public EnsembleProperties {
		sources = sources == null ? List.of() : List.copyOf(sources);
	}

	public record Source(
		@NotBlank String name,
		@NotNull URI endpoint,
		@PositiveOrZero Double weight
	) {}
}
