package io.evitadb.lingua.pipeline;

import io.evitadb.lingua.model.EntryKey;
import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.model.PoEntry;
import io.evitadb.lingua.model.TranslationTask;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the fields of a catalog that need a translation, in catalog order.
 *
 * The header, obsolete entries and entries with an empty `msgid` are skipped. A singular entry
 * yields a task for its `msgstr`; a plural entry yields one task per plural form, where form 0 is
 * translated from `msgid` and the other forms from `msgid_plural`. Fields that already have a
 * translation are only included when retranslating.
 */
public final class TaskExtractor {

	private TaskExtractor() {
		// Utility class - prevent instantiation
	}

	/**
	 * Extracts translation tasks from the catalog.
	 *
	 * @param catalog     the catalog
	 * @param retranslate whether to include fields that are already translated
	 * @return tasks in catalog order
	 */
	@Nonnull
	public static List<TranslationTask> extract(@Nonnull PoCatalog catalog, boolean retranslate) {
		Objects.requireNonNull(catalog, "catalog must not be null");

		final int pluralForms = catalog.getPluralFormCount();
		final List<TranslationTask> tasks = new ArrayList<>();
		for (int index = 0; index < catalog.size(); index++) {
			final PoEntry entry = catalog.getEntry(index);
			if (entry.isHeader() || entry.isObsolete() || entry.getMsgid().isEmpty()) {
				continue;
			}

			if (!entry.isPlural()) {
				if (retranslate || entry.getMsgstr().isEmpty()) {
					tasks.add(new TranslationTask(EntryKey.primary(index), entry.getMsgid()));
				}
				continue;
			}

			final SortedSet<Integer> forms = new TreeSet<>(entry.getMsgstrPlural().keySet());
			for (int form = 0; form < pluralForms; form++) {
				forms.add(form);
			}
			for (final int form : forms) {
				if (retranslate || entry.getTranslation(form).isEmpty()) {
					tasks.add(new TranslationTask(EntryKey.plural(index, form), entry.getSourceText(form)));
				}
			}
		}
		return tasks;
	}
}
