package org.lokray.eqcfg.semantic;

import org.lokray.eqcfg.ast.ArrayTypeNode;
import org.lokray.eqcfg.ast.ArrayValueNode;
import org.lokray.eqcfg.ast.AstBaseVisitor;
import org.lokray.eqcfg.ast.AstNode;
import org.lokray.eqcfg.ast.BindDirectiveNode;
import org.lokray.eqcfg.ast.ConnectionNode;
import org.lokray.eqcfg.ast.ContextNode;
import org.lokray.eqcfg.ast.DynamicNameNode;
import org.lokray.eqcfg.ast.ModuleNode;
import org.lokray.eqcfg.ast.ObjectNode;
import org.lokray.eqcfg.ast.OptionNode;
import org.lokray.eqcfg.ast.ParameterAssignNode;
import org.lokray.eqcfg.ast.PutDirectiveNode;
import org.lokray.eqcfg.ast.RangeNode;
import org.lokray.eqcfg.ast.SignalNode;
import org.lokray.eqcfg.ast.TemplateNode;
import org.lokray.eqcfg.ast.TypeNode;
import org.lokray.eqcfg.ast.UseDirectiveNode;
import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.ast.VarDeclarationNode;
import org.lokray.eqcfg.ast.VarRefNode;
import org.lokray.eqcfg.error.DirectiveException;
import org.lokray.eqcfg.error.ParameterException;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.error.TypeMismatchException;
import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.scope.ConnectionScope;
import org.lokray.eqcfg.semantic.scope.ContextScope;
import org.lokray.eqcfg.semantic.scope.EquipmentScope;
import org.lokray.eqcfg.semantic.scope.ModuleScope;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.scope.ScopeRegistry;
import org.lokray.eqcfg.semantic.scope.SignalScope;
import org.lokray.eqcfg.semantic.scope.TemplateScope;
import org.lokray.eqcfg.semantic.symbol.BuiltinTypeSymbol;
import org.lokray.eqcfg.semantic.symbol.NotInitializedSymbol;
import org.lokray.eqcfg.semantic.symbol.OptionFamily;
import org.lokray.eqcfg.semantic.symbol.ParameterFactory;
import org.lokray.eqcfg.semantic.symbol.ParameterSymbol;
import org.lokray.eqcfg.semantic.symbol.Symbol;
import org.lokray.eqcfg.semantic.symbol.ValueEvaluator;
import org.lokray.eqcfg.semantic.symbol.VariableSymbol;
import org.lokray.eqcfg.semantic.type.ArrayType;
import org.lokray.eqcfg.semantic.type.Type;
import org.lokray.eqcfg.semantic.type.TypeMatcher;
import org.lokray.eqcfg.semantic.type.ValueTag;
import org.lokray.eqcfg.util.Debug;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * First pass over the tree: creates one scope per block, declares variables and parameters,
 * and records the context wiring (listeners from use directives, resolvers from put
 * directives) that the replay pass drives afterwards.
 */
public class SymbolTableBuilder extends AstBaseVisitor<Void>
{
	private final CompilerOptions options;
	private final ScopeRegistry registry = new ScopeRegistry();
	private final Map<ContextScope, List<ContextListener>> listeners = new IdentityHashMap<>();
	private final Map<ContextScope, ContextResolver> resolvers = new LinkedHashMap<>();

	private Scope currentScope;
	private SourcePosition currentPosition = SourcePosition.UNKNOWN;

	public SymbolTableBuilder(CompilerOptions options)
	{
		this.options = options;
	}

	public ScopeRegistry getRegistry()
	{
		return registry;
	}

	/**
	 * @return The scopes registered by use directives for {@code context}, in registration order.
	 */
	public List<ContextListener> getListeners(ContextScope context)
	{
		return listeners.getOrDefault(context, List.of());
	}

	public List<ContextResolver> getResolvers()
	{
		return new ArrayList<>(resolvers.values());
	}

	/**
	 * @return The position of the node being elaborated, used to trace errors raised without one.
	 */
	public SourcePosition getCurrentPosition()
	{
		return currentPosition;
	}

	private void enter(AstNode node)
	{
		if (node.getPosition() != null && node.getPosition().isKnown())
		{
			currentPosition = node.getPosition();
		}
	}

	// --- Blocks ---

	@Override
	public Void visitModule(ModuleNode node)
	{
		ModuleScope module = new ModuleScope(node.getName());
		BuiltInTypeLoader.definePrimitives(module);
		BuiltInTypeLoader.defineDirectives(module);
		registry.register(module);
		Debug.logDebug("Created module scope '" + module.getName() + "'");

		currentScope = module;
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getBlocks());
		return null;
	}

	@Override
	public Void visitTemplate(TemplateNode node)
	{
		enter(node);
		Scope enclosing = currentScope;
		TemplateScope template = obtainScope(node.getName(), TemplateScope.class, () -> new TemplateScope(node.getName(), enclosing));

		currentScope = template;
		visitAll(node.getContexts());
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getConnections());
		visitAll(node.getBlocks());
		currentScope = enclosing;
		return null;
	}

	@Override
	public Void visitContext(ContextNode node)
	{
		enter(node);
		if (!(currentScope instanceof TemplateScope template))
		{
			throw new TypeMismatchException("context '" + node.getName() + "' declared outside of a template");
		}

		ContextScope context = new ContextScope(node.getName(), template);
		template.addContext(context);
		for (VarDeclarationNode declaration : node.getVariables())
		{
			enter(declaration);
			Type type = resolveType(declaration.getType());
			for (String name : declaration.getNames())
			{
				if (currentScope.lookup(name).isPresent())
				{
					throw new SemanticException("attempt to redefine registered var name '" + name + "'");
				}
				context.declare(new VariableSymbol(name, type));
			}
		}
		Debug.logDebug("Declared context '" + context.getName() + "' with " + context.getSymbolKeys());
		return null;
	}

	@Override
	public Void visitObject(ObjectNode node)
	{
		enter(node);
		Scope enclosing = currentScope;
		String key = registryKey(node.getName(), node.getNameExtensions());
		EquipmentScope equipment = obtainScope(key, EquipmentScope.class,
				() -> new EquipmentScope(key, node.getName(), node.getObjectType(), enclosing));
		equipment.setNameExtensions(extensionNames(node.getNameExtensions()));

		currentScope = equipment;
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getParameters());
		visitAll(node.getConnections());
		visitAll(node.getBlocks());
		currentScope = enclosing;
		return null;
	}

	@Override
	public Void visitSignal(SignalNode node)
	{
		enter(node);
		Scope enclosing = currentScope;
		String key = registryKey(node.getName(), node.getNameExtensions());
		SignalScope signal = obtainScope(key, SignalScope.class,
				() -> new SignalScope(key, node.getName(), node.getDirection(), node.getSignalType(), enclosing));
		signal.setNameExtensions(extensionNames(node.getNameExtensions()));

		currentScope = signal;
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getParameters());
		if (node.getConnection() != null)
		{
			node.getConnection().accept(this);
		}
		currentScope = enclosing;
		return null;
	}

	@Override
	public Void visitConnection(ConnectionNode node)
	{
		enter(node);
		Scope enclosing = currentScope;

		StringBuilder fullName = new StringBuilder(node.getName());
		for (VarRefNode extension : node.getNameExtensions())
		{
			VariableSymbol variable = ValueEvaluator.resolveVariable(extension.getName(), enclosing);
			if (!variable.hasValue())
			{
				throw new SemanticException("name resolve from context (symbol '" + extension.getName() + "') not allowed for connection '" + node.getName() + "'");
			}
			fullName.append(ValueEvaluator.format(variable.getValue()));
		}
		String key = fullName.toString();

		Optional<Scope> existing = registry.get(key);
		if (existing.isPresent())
		{
			if (!(existing.get() instanceof ConnectionScope connection))
			{
				throw new SemanticException("scope '" + key + "' already registered as " + existing.get().getKind().getLabel());
			}
			Debug.logDebug("Connection '" + key + "' already built, body skipped");
			declareConnection(enclosing, connection);
			return null;
		}

		ConnectionScope connection = new ConnectionScope(key, node.getName(), enclosing);
		registry.register(connection);
		declareConnection(enclosing, connection);

		currentScope = connection;
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getParameters());
		currentScope = enclosing;
		return null;
	}

	private void declareConnection(Scope enclosing, ConnectionScope connection)
	{
		Optional<Symbol> declared = enclosing.lookup(connection.getName(), true);
		if (declared.isEmpty() || declared.get() != connection)
		{
			enclosing.declare(connection.getName(), connection);
		}

		// A connection written inside a signal is the connection of that signal.
		if (enclosing instanceof SignalScope signal)
		{
			signal.bindTo(connection);
		}
	}

	// --- Declarations ---

	@Override
	public Void visitVarDeclaration(VarDeclarationNode node)
	{
		enter(node);
		Type type = resolveType(node.getType());
		for (String name : node.getNames())
		{
			if (currentScope.lookup(name).isPresent())
			{
				throw new SemanticException("attempt to redefine registered var name '" + name + "'");
			}

			VariableSymbol variable = new VariableSymbol(name, type);
			if (node.hasInitializer())
			{
				initialize(variable, node.getInitializer());
			}
			currentScope.declare(name, variable);
		}
		return null;
	}

	private void initialize(VariableSymbol variable, ValueNode initializer)
	{
		if (initializer instanceof VarRefNode ref)
		{
			VariableSymbol target = ValueEvaluator.resolveVariable(ref.getName(), currentScope);
			if (!TypeMatcher.matches(variable.getType(), target.getValueTag()))
			{
				throw new TypeMismatchException("declared " + variable.getType().getName() + " got $" + ref.getName()
						+ " of type " + target.getType().getName() + " for var '" + variable.getName() + "'");
			}
			variable.aliasTo(target);
			return;
		}

		checkReferences(initializer);
		ValueTag tag = ValueEvaluator.tagOf(initializer, currentScope);
		if (!TypeMatcher.matches(variable.getType(), tag))
		{
			throw new TypeMismatchException("declared " + variable.getType().getName() + " got " + initializer + " for var '" + variable.getName() + "'");
		}
		variable.setValue(initializer, currentScope);
	}

	/**
	 * Every variable a value mentions, inside arrays and dynamic names included, must be visible.
	 */
	private void checkReferences(ValueNode value)
	{
		if (value instanceof VarRefNode ref)
		{
			ValueEvaluator.resolveVariable(ref.getName(), currentScope);
		}
		else if (value instanceof DynamicNameNode name)
		{
			for (VarRefNode extension : name.getExtensions())
			{
				ValueEvaluator.resolveVariable(extension.getName(), currentScope);
			}
		}
		else if (value instanceof ArrayValueNode array)
		{
			for (ValueNode item : array.getItems())
			{
				checkReferences(item);
			}
		}
		else if (value instanceof RangeNode range)
		{
			checkReferences(range.getMin());
			checkReferences(range.getMax());
		}
	}

	@Override
	public Void visitParameterAssign(ParameterAssignNode node)
	{
		enter(node);
		Type type = resolveType(node.getType());
		ValueNode value = node.getValue();

		Symbol reference = null;
		ValueTag tag;
		if (value instanceof VarRefNode ref)
		{
			VariableSymbol variable = ValueEvaluator.resolveVariable(ref.getName(), currentScope);
			reference = variable.hasValue() ? variable : new NotInitializedSymbol(variable.getName(), variable.getType());
			tag = variable.getValueTag();
		}
		else
		{
			checkReferences(value);
			tag = ValueEvaluator.tagOf(value, currentScope);
		}

		ParameterSymbol parameter = ParameterFactory.create(currentScope.getKind(), node.getName(), type, options.isStrictEquipmentOptions())
				.orElseThrow(() -> new ParameterException("impossible parameter '" + node.getName() + "' for "
						+ currentScope.getKind().getLabel() + " scope '" + currentScope.getName() + "'"));
		currentScope.declareParameter(node.getName(), parameter);

		for (ParameterSymbol declared : currentScope.lookupParameter(node.getName()))
		{
			if (declared.hasValue())
			{
				continue;
			}
			if (!TypeMatcher.matches(declared.getType(), tag))
			{
				throw new TypeMismatchException("declared " + declared.getType().getName() + " got " + value + " for parameter '" + node.getName() + "'");
			}
			if (value instanceof RangeNode && !declared.acceptsRange())
			{
				throw new TypeMismatchException("range is not supported for '" + node.getName() + "' parameter");
			}

			if (reference != null)
			{
				declared.setReference(reference, currentScope);
			}
			else
			{
				declared.setValue(value, currentScope);
			}
			for (OptionNode option : node.getOptions())
			{
				registerOption(declared, option);
			}
		}
		return null;
	}

	private void registerOption(ParameterSymbol parameter, OptionNode option)
	{
		enter(option);
		OptionFamily family = option.isConnectionOption() ? OptionFamily.CONNECTION : OptionFamily.SIGNAL;
		VariableSymbol variable = null;
		if (option.getValue() instanceof VarRefNode ref)
		{
			Optional<Symbol> symbol = currentScope.lookup(ref.getName());
			if (symbol.isEmpty() || !(symbol.get() instanceof VariableSymbol found))
			{
				throw new SemanticException("option '" + option.getName() + "' refers to unknown var '" + ref.getName() + "'");
			}
			variable = found;
		}
		parameter.registerOption(option.getName(), family, option.getValue(), variable, currentScope);
	}

	// --- Directives ---

	@Override
	public Void visitBindDirective(BindDirectiveNode node)
	{
		enter(node);
		StringBuilder fullName = new StringBuilder(node.getName());
		for (VarRefNode extension : node.getExtensions())
		{
			VariableSymbol variable = ValueEvaluator.resolveVariable(extension.getName(), currentScope);
			Object value = variable.getValue();
			if (value == null)
			{
				throw new DirectiveException("bind extension '$" + extension.getName() + "' has no value");
			}
			fullName.append(ValueEvaluator.format(value));
		}

		String target = fullName.toString();
		Optional<Symbol> symbol = currentScope.lookup(target);
		if (symbol.isEmpty() || !(symbol.get() instanceof ConnectionScope connection))
		{
			throw new DirectiveException("connection '" + target + "' not found for bind");
		}

		if (currentScope instanceof SignalScope signal)
		{
			signal.bindTo(connection);
			Debug.logDebug("Bound signal '" + signal.getName() + "' to connection '" + connection.getName() + "'");
		}
		else
		{
			Debug.logDebug("Bind to '" + target + "' ignored in " + currentScope.getKind().getLabel() + " scope '" + currentScope.getName() + "'");
		}
		return null;
	}

	@Override
	public Void visitUseDirective(UseDirectiveNode node)
	{
		enter(node);
		Optional<ContextScope> context = currentScope.lookupContext(node.getName());
		if (context.isEmpty())
		{
			Debug.logWarning("Context '" + node.getName() + "' used by '" + currentScope.getName() + "' is not declared in an enclosing template");
			return null;
		}

		ValueNode excluded = node.getFilter() == null ? null : node.getFilter().getExcluded();
		if (excluded != null)
		{
			checkReferences(excluded);
		}
		List<ContextListener> registered = listeners.computeIfAbsent(context.get(), k -> new ArrayList<>());
		for (ContextListener listener : registered)
		{
			if (listener.getScope() == currentScope)
			{
				Debug.logDebug("Scope '" + currentScope.getName() + "' already listens to context '" + node.getName() + "'");
				return null;
			}
		}
		registered.add(new ContextListener(currentScope, node.getMethod(), excluded));
		if (currentScope.getContext() != context.get())
		{
			currentScope.bindContext(context.get());
		}
		return null;
	}

	@Override
	public Void visitPutDirective(PutDirectiveNode node)
	{
		enter(node);
		String sourceName = node.getSource().getName();
		Optional<Symbol> source = currentScope.lookup(sourceName);
		if (source.isEmpty() || !(source.get() instanceof VariableSymbol variable))
		{
			throw new DirectiveException("symbol '" + sourceName + "' not found for put into context '" + node.getName() + "'");
		}
		if (!variable.getType().isArray())
		{
			throw new DirectiveException("symbol '" + sourceName + "' is " + variable.getType().getName() + ", expected arr");
		}

		Optional<ContextScope> context = currentScope.lookupContext(node.getName());
		if (context.isEmpty())
		{
			throw new DirectiveException("context '" + node.getName() + "' not found");
		}
		if (resolvers.containsKey(context.get()))
		{
			throw new DirectiveException("context '" + node.getName() + "' already has a data source");
		}

		resolvers.put(context.get(), new ContextResolver(context.get(), variable, node.getRule(), currentScope, node.getPosition()));
		Debug.logDebug("Context '" + node.getName() + "' fed from '" + sourceName + "'");
		return null;
	}

	// --- Helpers ---

	private Type resolveType(TypeNode node)
	{
		if (node instanceof ArrayTypeNode shape)
		{
			List<ArrayType.Element> elements = new ArrayList<>();
			for (ArrayTypeNode.Element element : shape.getElements())
			{
				elements.add(new ArrayType.Element(resolveType(element.getType()), element.getSize(), element.isRepeated()));
			}
			return new ArrayType(elements);
		}

		Optional<Symbol> symbol = currentScope.lookup(node.getName());
		if (symbol.isEmpty() || !(symbol.get() instanceof BuiltinTypeSymbol builtin))
		{
			throw new TypeMismatchException("unknown type '" + node.getName() + "'");
		}
		return builtin.getType();
	}

	/**
	 * The base name followed by every extension value. When an extension has no value yet
	 * (a context variable filled in at replay) the key is the name pattern qualified by the
	 * enclosing scope instead, e.g. {@code T/S+$a}, so distinct templated blocks never share
	 * a scope.
	 */
	private String registryKey(String baseName, List<VarRefNode> extensions)
	{
		StringBuilder key = new StringBuilder(baseName);
		StringBuilder pattern = new StringBuilder(baseName);
		boolean resolved = true;
		for (VarRefNode extension : extensions)
		{
			Optional<Symbol> symbol = currentScope.lookup(extension.getName());
			if (symbol.isEmpty() || !(symbol.get() instanceof VariableSymbol variable))
			{
				throw new SemanticException("var '" + extension.getName() + "' not found for dynamic name '" + baseName + "'");
			}
			pattern.append("+$").append(extension.getName());
			if (variable.hasValue())
			{
				key.append(ValueEvaluator.format(variable.getValue()));
			}
			else
			{
				resolved = false;
			}
		}
		return resolved ? key.toString() : currentScope.getName() + "/" + pattern;
	}

	private static List<String> extensionNames(List<VarRefNode> extensions)
	{
		List<String> names = new ArrayList<>(extensions.size());
		for (VarRefNode extension : extensions)
		{
			names.add(extension.getName());
		}
		return names;
	}

	/**
	 * Reuses the scope registered under {@code key} when it has the expected kind, otherwise
	 * creates and registers a new one.
	 */
	private <S extends Scope> S obtainScope(String key, Class<S> kind, Supplier<S> factory)
	{
		Optional<Scope> existing = registry.get(key);
		if (existing.isPresent())
		{
			if (!kind.isInstance(existing.get()))
			{
				throw new SemanticException("scope '" + key + "' already registered as " + existing.get().getKind().getLabel());
			}
			Debug.logDebug("Reusing scope '" + key + "'");
			return kind.cast(existing.get());
		}

		S scope = factory.get();
		registry.register(scope);
		return scope;
	}
}
