package org.lokray.eqcfg.ast;

public enum NodeKind
{
	MODULE,
	TEMPLATE,
	CONTEXT,
	OBJECT,
	SIGNAL,
	CONNECTION,

	VAR_DECLARATION,
	PARAM_ASSIGN,
	OPTION,

	TYPE,
	ARRAY_TYPE,

	LITERAL,
	ARRAY,
	RANGE,
	OPEN_BOUND,
	SYSTEM_CONST,
	VARIABLE,
	DYNAMIC_NAME,

	USE_DIRECTIVE,
	USE_FILTER,
	PUT_DIRECTIVE,
	PUT_RULE,
	BIND_DIRECTIVE
}
