package com.notropolis.economy.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.notropolis.economy.cli.exception.OptionsValidationException;
import com.notropolis.economy.cli.model.TickOptions;
import com.notropolis.economy.cli.model.ValidatedTickOptions;
import com.notropolis.economy.config.EngineConfig;

public class TickOptionsValidator {

	public ValidatedTickOptions validate(TickOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getWorld() == null) {
			errors.add("World snapshot is required (--world / -w).");
		} else if (!Files.isRegularFile(o.getWorld())) {
			errors.add("World snapshot does not exist or is not a file: " + o.getWorld());
		}

		if (o.getTicks() < 1) {
			errors.add("Tick count must be >= 1. Got: " + o.getTicks());
		}
		if (o.getRecomputeBudgetMs() <= 0) {
			errors.add("Recompute budget must be > 0 ms. Got: " + o.getRecomputeBudgetMs());
		}
		if (o.getLeaseTimeoutMs() < 0) {
			errors.add("Lease timeout must be >= 0 ms. Got: " + o.getLeaseTimeoutMs());
		}

		Path output = o.getOutput() == null ? null : o.getOutput().toAbsolutePath().normalize();
		if (output != null && Files.exists(output) && !o.isForce()) {
			errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
		}
		if (output != null && Files.isDirectory(output)) {
			errors.add("Output must be a file, not a directory: " + output);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		EngineConfig config = EngineConfig.builder()
				.recomputeBudget(Duration.ofMillis(o.getRecomputeBudgetMs()))
				.leaseWaitTimeout(Duration.ofMillis(o.getLeaseTimeoutMs()))
				.build();
		return new ValidatedTickOptions(o.getWorld().toAbsolutePath().normalize(), output, config);
	}
}
