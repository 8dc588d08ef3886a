package io.evitadb.lingua.backend;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Backend that returns the text unchanged, optionally marked with a prefix.
 * Selected by the `echo` provider to exercise the whole pipeline without any remote service.
 */
public final class EchoTranslationBackend implements TranslationBackend {

	@Nonnull
	private final String prefix;

	public EchoTranslationBackend() {
		this("");
	}

	public EchoTranslationBackend(@Nonnull String prefix) {
		this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
	}

	@Nonnull
	@Override
	public String translate(@Nonnull String text, @Nonnull String sourceLang, @Nonnull String targetLang) {
		return this.prefix + text;
	}

	@Nonnull
	@Override
	public String name() {
		return "echo";
	}
}
