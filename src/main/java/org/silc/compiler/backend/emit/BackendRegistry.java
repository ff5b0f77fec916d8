package org.silc.compiler.backend.emit;

import org.silc.compiler.backend.emit.syntax.CppSyntax;
import org.silc.compiler.backend.emit.syntax.PythonSyntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of backend syntax tables by name, in registration order.
 */
public final class BackendRegistry {

	private final Map<String, IBackendSyntax> backends = new LinkedHashMap<>();

	/**
	 * Registers a backend under its {@link IBackendSyntax#name()}, replacing any previous one.
	 * @param syntax The backend table.
	 */
	public void register(IBackendSyntax syntax) { backends.put(syntax.name(), syntax); }

	/**
	 * @return All registered backend names, in registration order.
	 */
	public List<String> names() { return List.copyOf(backends.keySet()); }

	/**
	 * Looks up the tables for the given names, keeping the requested order.
	 * @param names Backend names, e.g. from {@code silc.backends}.
	 * @return The matching tables.
	 * @throws IllegalArgumentException if a name is not registered or listed twice.
	 */
	public List<IBackendSyntax> select(List<String> names) {
		List<IBackendSyntax> selected = new ArrayList<>();
		for (String name : names) {
			IBackendSyntax syntax = backends.get(name);
			if (syntax == null) {
				throw new IllegalArgumentException("Unknown backend '" + name + "'; available: " + backends.keySet());
			}
			if (selected.contains(syntax)) {
				throw new IllegalArgumentException("Backend '" + name + "' is listed more than once");
			}
			selected.add(syntax);
		}
		return Collections.unmodifiableList(selected);
	}

	/**
	 * Initializes a registry with the Python and C++ backends.
	 * @param indent The indentation unit both backends use.
	 * @return A new registry with the default backends.
	 */
	public static BackendRegistry initializeWithDefaults(String indent) {
		BackendRegistry reg = new BackendRegistry();
		reg.register(new PythonSyntax(indent));
		reg.register(new CppSyntax(indent));
		return reg;
	}
}
