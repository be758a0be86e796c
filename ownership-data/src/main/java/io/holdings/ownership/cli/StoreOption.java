package io.holdings.ownership.cli;

import io.holdings.config.IngestionConfig;
import picocli.CommandLine;

import java.nio.file.Path;

/** {@code --store} shared by every subcommand; falls back to the configured store directory. */
final class StoreOption {
    @CommandLine.Option(names = "--store", description = "Store root directory (default: holdings.storeDir / HOLDINGS_STORE_DIR)")
    Path store;

    IngestionConfig apply(IngestionConfig config) {
        return store == null ? config : config.withStoreDir(store);
    }
}
