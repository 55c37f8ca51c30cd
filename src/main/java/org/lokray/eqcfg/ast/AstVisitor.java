package org.lokray.eqcfg.ast;

/**
 * One method per node kind. Nodes call back the matching method from {@link AstNode#accept}.
 */
public interface AstVisitor<T>
{
	T visitModule(ModuleNode node);

	T visitTemplate(TemplateNode node);

	T visitContext(ContextNode node);

	T visitObject(ObjectNode node);

	T visitSignal(SignalNode node);

	T visitConnection(ConnectionNode node);

	T visitVarDeclaration(VarDeclarationNode node);

	T visitParameterAssign(ParameterAssignNode node);

	T visitOption(OptionNode node);

	T visitType(TypeNode node);

	T visitArrayType(ArrayTypeNode node);

	T visitLiteral(LiteralNode node);

	T visitArrayValue(ArrayValueNode node);

	T visitRange(RangeNode node);

	T visitOpenBound(OpenBoundNode node);

	T visitSystemConst(SystemConstNode node);

	T visitVarRef(VarRefNode node);

	T visitDynamicName(DynamicNameNode node);

	T visitUseDirective(UseDirectiveNode node);

	T visitUseFilter(UseFilterNode node);

	T visitPutDirective(PutDirectiveNode node);

	T visitPutRule(PutRuleNode node);

	T visitBindDirective(BindDirectiveNode node);
}
