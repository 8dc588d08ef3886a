package io.evitadb.lingua;

import org.apache.maven.plugin.logging.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maven log that keeps info, warn and error messages for assertions.
 */
public class RecordingLog implements Log {
	private final List<String> infos = Collections.synchronizedList(new ArrayList<>());
	private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
	private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

	@Override public boolean isDebugEnabled() { return true; }
	@Override public void debug(CharSequence content) {}
	@Override public void debug(CharSequence content, Throwable error) {}
	@Override public void debug(Throwable error) {}
	@Override public boolean isInfoEnabled() { return true; }
	@Override public void info(CharSequence content) { infos.add(content.toString()); }
	@Override public void info(CharSequence content, Throwable error) { infos.add(content.toString()); }
	@Override public void info(Throwable error) {}
	@Override public boolean isWarnEnabled() { return true; }
	@Override public void warn(CharSequence content) { warnings.add(content.toString()); }
	@Override public void warn(CharSequence content, Throwable error) { warnings.add(content.toString()); }
	@Override public void warn(Throwable error) {}
	@Override public boolean isErrorEnabled() { return true; }
	@Override public void error(CharSequence content) { errors.add(content.toString()); }
	@Override public void error(CharSequence content, Throwable error) { errors.add(content.toString()); }
	@Override public void error(Throwable error) {}

	public boolean hasInfo(String substring) {
		return contains(infos, substring);
	}

	public boolean hasWarning(String substring) {
		return contains(warnings, substring);
	}

	public boolean hasError(String substring) {
		return contains(errors, substring);
	}

	public List<String> getInfos() {
		synchronized (infos) {
			return new ArrayList<>(infos);
		}
	}

	private static boolean contains(List<String> messages, String substring) {
		synchronized (messages) {
			return messages.stream().anyMatch(s -> s.toLowerCase().contains(substring.toLowerCase()));
		}
	}
}
