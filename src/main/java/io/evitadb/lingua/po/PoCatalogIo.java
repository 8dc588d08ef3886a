package io.evitadb.lingua.po;

import io.evitadb.lingua.model.PoCatalog;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link CatalogIo} for gettext PO files encoded in UTF-8.
 */
public final class PoCatalogIo implements CatalogIo {

	private final PoParser parser = new PoParser();
	private final PoWriter writer = new PoWriter();

	@Nonnull
	@Override
	public PoCatalog load(@Nonnull Path path) throws IOException {
		Objects.requireNonNull(path, "path must not be null");
		return this.parser.parse(Files.readString(path, StandardCharsets.UTF_8));
	}

	@Override
	public void save(@Nonnull PoCatalog catalog, @Nonnull Path path) throws IOException {
		Objects.requireNonNull(catalog, "catalog must not be null");
		Objects.requireNonNull(path, "path must not be null");

		final Path absolute = path.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(absolute, this.writer.write(catalog).getBytes(StandardCharsets.UTF_8));
	}
}
