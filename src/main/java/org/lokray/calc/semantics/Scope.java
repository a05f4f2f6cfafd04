package org.lokray.calc.semantics;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The single flat scope of a calc program: the set of declared variable names.
 * There is no nesting and no shadowing.
 */
public class Scope
{
	private final Set<String> names = new LinkedHashSet<>();

	/**
	 * Declares a name.
	 *
	 * @param name The variable name.
	 * @return False if the name was already declared.
	 */
	public boolean declare(String name)
	{
		return names.add(name);
	}

	public boolean isDeclared(String name)
	{
		return names.contains(name);
	}

	/**
	 * @return The declared names, in declaration order.
	 */
	public Set<String> getNames()
	{
		return Collections.unmodifiableSet(names);
	}

	@Override
	public String toString()
	{
		return "Scope" + names;
	}
}
