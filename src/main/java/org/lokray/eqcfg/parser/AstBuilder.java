package org.lokray.eqcfg.parser;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.eqcfg.ast.ArrayTypeNode;
import org.lokray.eqcfg.ast.ArrayValueNode;
import org.lokray.eqcfg.ast.AstNode;
import org.lokray.eqcfg.ast.BindDirectiveNode;
import org.lokray.eqcfg.ast.BlockNode;
import org.lokray.eqcfg.ast.ConnectionNode;
import org.lokray.eqcfg.ast.ContextNode;
import org.lokray.eqcfg.ast.DynamicNameNode;
import org.lokray.eqcfg.ast.LiteralNode;
import org.lokray.eqcfg.ast.ModuleNode;
import org.lokray.eqcfg.ast.ObjectNode;
import org.lokray.eqcfg.ast.OpenBoundNode;
import org.lokray.eqcfg.ast.OptionNode;
import org.lokray.eqcfg.ast.ParameterAssignNode;
import org.lokray.eqcfg.ast.ParameterizedBlockNode;
import org.lokray.eqcfg.ast.PutDirectiveNode;
import org.lokray.eqcfg.ast.PutRuleNode;
import org.lokray.eqcfg.ast.RangeNode;
import org.lokray.eqcfg.ast.SignalNode;
import org.lokray.eqcfg.ast.SystemConstNode;
import org.lokray.eqcfg.ast.TemplateNode;
import org.lokray.eqcfg.ast.TypeNode;
import org.lokray.eqcfg.ast.UseDirectiveNode;
import org.lokray.eqcfg.ast.UseFilterNode;
import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.ast.VarDeclarationNode;
import org.lokray.eqcfg.ast.VarRefNode;
import org.lokray.eqcfg.error.SyntaxException;
import org.lokray.eqcfg.semantic.type.ValueTag;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the parse tree and builds the AST. The grammar accepts any member in any body; which
 * members a block kind accepts is checked here, against the block currently being filled.
 */
public class AstBuilder extends EqCfgBaseVisitor<AstNode>
{
	// Nesting limit for array shapes
	public static final int TYPE_MATCHING_LIMIT = 100;

	private final SourceText source;
	private BlockNode owner;

	public AstBuilder(SourceText source)
	{
		this.source = source;
	}

	public ModuleNode build(EqCfgParser.CompilationUnitContext tree)
	{
		return (ModuleNode) visit(tree);
	}

	// --- Helpers ---

	private SourcePosition position(Token token)
	{
		return new SourcePosition(token.getLine(), token.getCharPositionInLine(), source.getLine(token.getLine()));
	}

	private SourcePosition position(TerminalNode node)
	{
		return position(node.getSymbol());
	}

	private SyntaxException error(Token token, String message)
	{
		return new SyntaxException(message, position(token).renderTrace());
	}

	private static String describe(BlockNode block)
	{
		return block.getKind().name().toLowerCase() + " '" + block.getName() + "'";
	}

	private static String unquote(String text)
	{
		return text.substring(1, text.length() - 1);
	}

	private List<VarRefNode> extensions(List<EqCfgParser.NameExtensionContext> contexts)
	{
		List<VarRefNode> extensions = new ArrayList<>();
		for (EqCfgParser.NameExtensionContext extension : contexts)
		{
			extensions.add(visitVarRef(extension.varRef()));
		}
		return extensions;
	}

	private void fillBody(EqCfgParser.BodyContext ctx, BlockNode block)
	{
		BlockNode enclosing = owner;
		owner = block;
		for (EqCfgParser.MemberContext member : ctx.member())
		{
			visitMember(member);
		}
		owner = enclosing;
	}

	// --- Module and members ---

	@Override
	public AstNode visitCompilationUnit(EqCfgParser.CompilationUnitContext ctx)
	{
		ModuleNode module = new ModuleNode(source.getName());
		owner = module;
		for (EqCfgParser.MemberContext member : ctx.member())
		{
			visitMember(member);
		}
		owner = null;
		return module;
	}

	/**
	 * Attaches one member to the block being filled, rejecting members the block kind does
	 * not accept.
	 */
	@Override
	public AstNode visitMember(EqCfgParser.MemberContext ctx)
	{
		if (ctx.varDeclaration() != null)
		{
			owner.addVariable(visitVarDeclaration(ctx.varDeclaration()));
		}
		else if (ctx.directive() != null)
		{
			owner.addDirective(visitDirective(ctx.directive()));
		}
		else if (ctx.parameter() != null)
		{
			if (!(owner instanceof ParameterizedBlockNode block))
			{
				throw error(ctx.start, "parameter assignment is not allowed in " + describe(owner));
			}
			block.addParameter(visitParameter(ctx.parameter()));
		}
		else if (ctx.contextBlock() != null)
		{
			if (!(owner instanceof TemplateNode template))
			{
				throw error(ctx.start, "context is only allowed in a template");
			}
			template.addContext(visitContextBlock(ctx.contextBlock()));
		}
		else if (ctx.templateBlock() != null)
		{
			if (!(owner instanceof ModuleNode module))
			{
				throw error(ctx.start, "template is only allowed at module level");
			}
			module.addBlock(visitTemplateBlock(ctx.templateBlock()));
		}
		else if (ctx.connectionBlock() != null)
		{
			attachConnection(ctx);
		}
		else
		{
			attachBlock(ctx);
		}
		return null;
	}

	private void attachBlock(EqCfgParser.MemberContext ctx)
	{
		if (owner instanceof ModuleNode module)
		{
			module.addBlock(visit(ctx.getChild(0)));
		}
		else if (owner instanceof TemplateNode template)
		{
			template.addBlock(visit(ctx.getChild(0)));
		}
		else if (owner instanceof ObjectNode object)
		{
			object.addBlock(visit(ctx.getChild(0)));
		}
		else
		{
			throw error(ctx.start, "nested block is not allowed in " + describe(owner));
		}
	}

	private void attachConnection(EqCfgParser.MemberContext ctx)
	{
		if (owner instanceof ModuleNode module)
		{
			module.addBlock(visitConnectionBlock(ctx.connectionBlock()));
		}
		else if (owner instanceof TemplateNode template)
		{
			template.addConnection(visitConnectionBlock(ctx.connectionBlock()));
		}
		else if (owner instanceof ObjectNode object)
		{
			object.addConnection(visitConnectionBlock(ctx.connectionBlock()));
		}
		else if (owner instanceof SignalNode signal)
		{
			signal.setConnection(visitConnectionBlock(ctx.connectionBlock()));
		}
		else
		{
			throw error(ctx.start, "connection is not allowed in " + describe(owner));
		}
	}

	// --- Blocks ---

	@Override
	public ObjectNode visitObjectBlock(EqCfgParser.ObjectBlockContext ctx)
	{
		String objectType = "класс_а".equals(ctx.OBJ_TYPE().getText()) ? "аналог" : "цифра";
		ObjectNode object = new ObjectNode(ctx.ID().getText(), objectType, extensions(ctx.nameExtension()), position(ctx.OBJ_CLASS()));
		fillBody(ctx.body(), object);
		return object;
	}

	@Override
	public TemplateNode visitTemplateBlock(EqCfgParser.TemplateBlockContext ctx)
	{
		TemplateNode template = new TemplateNode(ctx.ID().getText(), position(ctx.TEMPL_KW()));
		fillBody(ctx.body(), template);
		return template;
	}

	@Override
	public ConnectionNode visitConnectionBlock(EqCfgParser.ConnectionBlockContext ctx)
	{
		ConnectionNode connection = new ConnectionNode(ctx.ID().getText(), extensions(ctx.nameExtension()), position(ctx.CONN_KW()));
		fillBody(ctx.body(), connection);
		return connection;
	}

	@Override
	public SignalNode visitSignalBlock(EqCfgParser.SignalBlockContext ctx)
	{
		SignalNode signal = new SignalNode(ctx.ID().getText(), ctx.SIGN_DIRECT().getText(), ctx.SIGN_TYPE().getText(),
				extensions(ctx.nameExtension()), position(ctx.SIGN_KW()));
		fillBody(ctx.body(), signal);
		return signal;
	}

	@Override
	public ContextNode visitContextBlock(EqCfgParser.ContextBlockContext ctx)
	{
		ContextNode context = new ContextNode(ctx.ID().getText(), position(ctx.CTX_KW()));
		for (EqCfgParser.VarDeclarationContext variable : ctx.varDeclaration())
		{
			context.addVariable(visitVarDeclaration(variable));
		}
		return context;
	}

	// --- Declarations ---

	@Override
	public VarRefNode visitVarRef(EqCfgParser.VarRefContext ctx)
	{
		return new VarRefNode(ctx.ID().getText(), position(ctx.VAR_SYMB()));
	}

	@Override
	public VarDeclarationNode visitVarDeclaration(EqCfgParser.VarDeclarationContext ctx)
	{
		List<String> names = new ArrayList<>();
		for (EqCfgParser.VarRefContext ref : ctx.varRef())
		{
			names.add(ref.ID().getText());
		}
		TypeNode type = visitTypeSpec(ctx.typeSpec());
		ValueNode initializer = ctx.initializer() == null ? null : (ValueNode) visitInitializer(ctx.initializer());
		return new VarDeclarationNode(names, type, initializer, position(ctx.start));
	}

	@Override
	public AstNode visitInitializer(EqCfgParser.InitializerContext ctx)
	{
		if (ctx.RP_OP() != null)
		{
			return new DynamicNameNode(ctx.ID().getText(), extensions(ctx.nameExtension()), position(ctx.RP_OP()));
		}
		if (ctx.varRef() != null)
		{
			return visitVarRef(ctx.varRef());
		}
		return visitValue(ctx.value());
	}

	@Override
	public ParameterAssignNode visitParameter(EqCfgParser.ParameterContext ctx)
	{
		TypeNode type = visitTypeSpec(ctx.typeSpec());
		ValueNode value = (ValueNode) visitParameterValue(ctx.parameterValue());
		List<OptionNode> options = new ArrayList<>();
		for (EqCfgParser.ParameterOptionContext option : ctx.parameterOption())
		{
			options.add(visitParameterOption(option));
		}
		return new ParameterAssignNode(ctx.ID().getText(), type, value, options, position(ctx.ID()));
	}

	@Override
	public AstNode visitParameterValue(EqCfgParser.ParameterValueContext ctx)
	{
		if (ctx.varRef() != null)
		{
			return visitVarRef(ctx.varRef());
		}
		if (ctx.rangeValue() != null)
		{
			return visitRangeValue(ctx.rangeValue());
		}
		return visitValue(ctx.value());
	}

	@Override
	public OptionNode visitParameterOption(EqCfgParser.ParameterOptionContext ctx)
	{
		Token option = ctx.start;
		ValueNode value = null;
		EqCfgParser.OptionValueContext valueCtx = ctx.optionValue();
		if (valueCtx != null)
		{
			if (valueCtx.varRef() != null)
			{
				value = visitVarRef(valueCtx.varRef());
			}
			else if (valueCtx.S_CONST() != null)
			{
				value = new SystemConstNode(valueCtx.S_CONST().getText(), position(valueCtx.S_CONST()));
			}
			else
			{
				value = (ValueNode) visitValue(valueCtx.value());
			}
		}
		return new OptionNode(option.getText(), ctx.CONN_OPT() != null, value, position(option));
	}

	// --- Types ---

	@Override
	public TypeNode visitTypeSpec(EqCfgParser.TypeSpecContext ctx)
	{
		if (ctx.scalarType() != null)
		{
			return new TypeNode(ctx.scalarType().getText(), position(ctx.start));
		}
		if (ctx.shape() == null)
		{
			return new TypeNode(ctx.ARRAY_CONST().getText(), position(ctx.ARRAY_CONST()));
		}
		return buildShape(ctx.shape(), position(ctx.ARRAY_CONST()), 1);
	}

	private ArrayTypeNode buildShape(EqCfgParser.ShapeContext ctx, SourcePosition position, int depth)
	{
		if (depth > TYPE_MATCHING_LIMIT)
		{
			throw error(ctx.start, "type matching depth limit " + depth);
		}

		List<ArrayTypeNode.Element> elements = new ArrayList<>();
		for (EqCfgParser.ShapeItemContext item : ctx.shapeItem())
		{
			TypeNode type;
			Token last;
			if (item.scalarType() != null)
			{
				type = new TypeNode(item.scalarType().getText(), position(item.scalarType().start));
				last = item.scalarType().stop;
			}
			else
			{
				type = buildShape(item.shape(), position(item.shape().start), depth + 1);
				last = item.shape().stop;
			}

			int size = -1;
			if (item.INT() != null)
			{
				size = parseSize(item.INT().getSymbol());
				last = item.INT().getSymbol();
			}

			boolean repeated = item.ELLIPSIS() != null;
			if (repeated && item.ELLIPSIS().getSymbol().getStartIndex() != last.getStopIndex() + 1)
			{
				throw error(item.ELLIPSIS().getSymbol(), "'..' must directly follow the element type");
			}
			elements.add(new ArrayTypeNode.Element(type, size, repeated));
		}
		return new ArrayTypeNode(elements, position);
	}

	private int parseSize(Token token)
	{
		try
		{
			return Integer.parseInt(token.getText());
		}
		catch (NumberFormatException e)
		{
			throw error(token, "element size out of range: " + token.getText());
		}
	}

	// --- Values ---

	@Override
	public AstNode visitValue(EqCfgParser.ValueContext ctx)
	{
		if (ctx.number() != null)
		{
			return visitNumber(ctx.number());
		}
		if (ctx.STR() != null)
		{
			return new LiteralNode(ValueTag.STR_LITERAL, unquote(ctx.STR().getText()), position(ctx.STR()));
		}
		if (ctx.BOOL() != null)
		{
			return new LiteralNode(ValueTag.BOOL_LITERAL, "Да".equals(ctx.BOOL().getText()), position(ctx.BOOL()));
		}
		return visitArrayValue(ctx.arrayValue());
	}

	@Override
	public LiteralNode visitNumber(EqCfgParser.NumberContext ctx)
	{
		boolean negative = ctx.MINUS() != null;
		SourcePosition position = position(ctx.start);
		if (ctx.FLOAT() != null)
		{
			return new LiteralNode(ValueTag.FLOAT_LITERAL, Double.parseDouble(ctx.FLOAT().getText()), negative, position);
		}
		return new LiteralNode(ValueTag.INT_LITERAL, parseLong(ctx.INT().getSymbol()), negative, position);
	}

	private long parseLong(Token token)
	{
		try
		{
			return Long.parseLong(token.getText());
		}
		catch (NumberFormatException e)
		{
			throw error(token, "integer literal out of range: " + token.getText());
		}
	}

	@Override
	public ArrayValueNode visitArrayValue(EqCfgParser.ArrayValueContext ctx)
	{
		List<ValueNode> items = new ArrayList<>();
		for (EqCfgParser.ItemContext item : ctx.item())
		{
			items.add((ValueNode) visitItem(item));
		}
		return new ArrayValueNode(items, position(ctx.SP_OP()));
	}

	@Override
	public AstNode visitItem(EqCfgParser.ItemContext ctx)
	{
		if (ctx.varRef() != null)
		{
			return visitVarRef(ctx.varRef());
		}
		return visitValue(ctx.value());
	}

	@Override
	public RangeNode visitRangeValue(EqCfgParser.RangeValueContext ctx)
	{
		ValueNode min = buildBound(ctx.bound(0), false);
		ValueNode max = buildBound(ctx.bound(1), true);
		return new RangeNode(min, max, position(ctx.RANGE_KW()));
	}

	private ValueNode buildBound(EqCfgParser.BoundContext ctx, boolean upper)
	{
		if (ctx.TILDA() != null)
		{
			return new OpenBoundNode(upper, position(ctx.TILDA()));
		}
		if (ctx.varRef() != null)
		{
			return visitVarRef(ctx.varRef());
		}
		return visitNumber(ctx.number());
	}

	// --- Directives ---

	@Override
	public AstNode visitDirective(EqCfgParser.DirectiveContext ctx)
	{
		if (ctx.useDirective() != null)
		{
			return visitUseDirective(ctx.useDirective());
		}
		if (ctx.putDirective() != null)
		{
			return visitPutDirective(ctx.putDirective());
		}
		return visitBindDirective(ctx.bindDirective());
	}

	@Override
	public UseDirectiveNode visitUseDirective(EqCfgParser.UseDirectiveContext ctx)
	{
		UseFilterNode filter;
		if (ctx.ALL() != null)
		{
			filter = new UseFilterNode(null, position(ctx.ALL()));
		}
		else
		{
			filter = new UseFilterNode((ValueNode) visitItem(ctx.item()), position(ctx.EXCL_KW()));
		}
		return new UseDirectiveNode(ctx.ID().getText(), ctx.USE_METHOD().getText(), filter, position(ctx.USE_KW()));
	}

	@Override
	public PutDirectiveNode visitPutDirective(EqCfgParser.PutDirectiveContext ctx)
	{
		PutRuleNode rule = null;
		EqCfgParser.PutRuleContext ruleCtx = ctx.putRule();
		if (ruleCtx != null)
		{
			SourcePosition rulePosition = position(ctx.RULE_KW());
			if (ruleCtx.varRef() != null)
			{
				rule = new PutRuleNode(visitVarRef(ruleCtx.varRef()), rulePosition);
			}
			else
			{
				long from = parseLong(ruleCtx.INT(0).getSymbol());
				long to = parseLong(ruleCtx.INT(1).getSymbol());
				rule = new PutRuleNode(from, to, rulePosition);
			}
		}
		return new PutDirectiveNode(ctx.ID().getText(), visitVarRef(ctx.varRef()), rule, position(ctx.PUT_KW()));
	}

	@Override
	public BindDirectiveNode visitBindDirective(EqCfgParser.BindDirectiveContext ctx)
	{
		return new BindDirectiveNode(ctx.ID().getText(), extensions(ctx.nameExtension()), position(ctx.BIND_KW()));
	}
}
