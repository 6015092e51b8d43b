package com.notropolis.economy.cli.model;

import java.nio.file.Path;

import com.notropolis.economy.config.EngineConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run the ticks. Keeps TickCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTickOptions {
    Path worldFile;
    Path outputFile;
    EngineConfig engineConfig;
}
