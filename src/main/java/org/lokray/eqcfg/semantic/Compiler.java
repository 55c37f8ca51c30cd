package org.lokray.eqcfg.semantic;

import org.lokray.eqcfg.ast.ModuleNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.emit.Instance;
import org.lokray.eqcfg.emit.InstanceCollector;
import org.lokray.eqcfg.error.CompilationException;
import org.lokray.eqcfg.parser.SourceParser;
import org.lokray.eqcfg.parser.SourceText;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.util.Debug;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one compilation of a source: parse, build the symbol tables, feed every context row
 * by row while replaying its listeners, then replay every scope that listens to no context.
 * <p>
 * A compiler holds the state of a single run and is not reusable across threads.
 */
public class Compiler
{
	private final SourceText source;
	private final CompilerOptions options;
	private SymbolTableBuilder builder;

	public Compiler(SourceText source)
	{
		this(source, CompilerOptions.defaults());
	}

	public Compiler(SourceText source, CompilerOptions options)
	{
		this.source = source;
		this.options = options;
	}

	/**
	 * Runs the whole pipeline and hands every replayed scope to {@code finalizer}. The replay
	 * is first run against a throwaway {@link InstanceCollector}; the caller's finalizer only
	 * sees scopes once that check replay went through.
	 *
	 * @return The finalizer, for chaining.
	 * @throws CompilationException on the first error; the finalizer has then seen nothing.
	 */
	public <F extends Finalizer> F run(F finalizer)
	{
		Debug.logDebug("PASS 0: Parsing '" + source.getName() + "' (" + source.lineCount() + " lines)...");
		ModuleNode module = new SourceParser(source).parse();

		Debug.logDebug("PASS 1: Building symbol tables...");
		builder = new SymbolTableBuilder(options);
		try
		{
			module.accept(builder);
		}
		catch (CompilationException e)
		{
			throw e.withTrace(builder.getCurrentPosition().renderTrace());
		}
		Debug.logDebug("Registered " + builder.getRegistry().size() + " scope(s), " + builder.getResolvers().size() + " context resolver(s)");

		Debug.logDebug("PASS 2: Checking replay...");
		replay(new InstanceCollector());

		Debug.logDebug("PASS 3: Replaying into " + finalizer.getClass().getSimpleName() + "...");
		replay(finalizer);
		return finalizer;
	}

	/**
	 * Feeds every context row by row, replaying the listeners each row admits, then replays
	 * every registered scope that listens to no context.
	 */
	private void replay(Finalizer finalizer)
	{
		Set<Scope> listening = Collections.newSetFromMap(new IdentityHashMap<>());
		for (ContextResolver resolver : builder.getResolvers())
		{
			List<ContextListener> listeners = builder.getListeners(resolver.getContext());
			resolver.rewind();
			try
			{
				Optional<RowBound> row = resolver.next();
				while (row.isPresent())
				{
					Debug.logDebug("Context '" + resolver.getContext().getName() + "' row " + row.get().getIndex() + " = " + row.get().getValues());
					for (ContextListener listener : listeners)
					{
						if (listener.admits(row.get()))
						{
							listener.getScope().accept(finalizer);
						}
					}
					row = resolver.next();
				}
			}
			catch (CompilationException e)
			{
				throw e.withTrace(resolver.getPosition().renderTrace());
			}

			for (ContextListener listener : listeners)
			{
				listening.add(listener.getScope());
			}
		}

		for (Scope scope : builder.getRegistry().getScopes())
		{
			if (!listening.contains(scope))
			{
				scope.accept(finalizer);
			}
		}
	}

	/**
	 * @return One instance per replayed scope, in replay order.
	 */
	public List<Instance> compile()
	{
		return run(new InstanceCollector()).getInstances();
	}

	/**
	 * @return The builder of the last run, or null before the first one.
	 */
	public SymbolTableBuilder getBuilder()
	{
		return builder;
	}
}
