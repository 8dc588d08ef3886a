package io.evitadb.lingua.po;

import io.evitadb.lingua.model.PoCatalog;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes catalogs from and to the file system.
 */
public interface CatalogIo {

	/**
	 * Loads the catalog stored in the given file.
	 *
	 * @param path the catalog file
	 * @return the parsed catalog
	 * @throws IOException if the file cannot be read or parsed
	 */
	@Nonnull
	PoCatalog load(@Nonnull Path path) throws IOException;

	/**
	 * Writes the catalog to the given file, creating parent directories as needed.
	 *
	 * @param catalog the catalog to write
	 * @param path    the target file
	 * @throws IOException if the file cannot be written
	 */
	void save(@Nonnull PoCatalog catalog, @Nonnull Path path) throws IOException;
}
