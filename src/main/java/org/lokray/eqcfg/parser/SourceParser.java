package org.lokray.eqcfg.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.lokray.eqcfg.ast.ModuleNode;
import org.lokray.eqcfg.error.SyntaxException;
import org.lokray.eqcfg.util.Debug;
import org.lokray.eqcfg.util.SyntaxErrorListener;

/**
 * Front end for one source: lexes and parses it with the generated ANTLR recognizers, then
 * builds the AST with {@link AstBuilder}.
 */
public class SourceParser
{
	private final SourceText source;

	public SourceParser(SourceText source)
	{
		this.source = source;
	}

	/**
	 * @throws SyntaxException on the first lexical or syntax error.
	 */
	public ModuleNode parse()
	{
		EqCfgParser parser = new EqCfgParser(new CommonTokenStream(createLexer(source)));

		// Replace the console listener so the first error stops the parse
		parser.removeErrorListeners();
		parser.addErrorListener(new SyntaxErrorListener(source));

		EqCfgParser.CompilationUnitContext tree = parser.compilationUnit();
		ModuleNode module = new AstBuilder(source).build(tree);
		Debug.logDebug("Parsed module " + module.getName() + ": " + module.getBlocks().size() + " block(s), "
				+ module.getVariables().size() + " variable(s), " + module.getDirectives().size() + " directive(s).");
		return module;
	}

	public static EqCfgLexer createLexer(SourceText source)
	{
		EqCfgLexer lexer = new EqCfgLexer(CharStreams.fromString(source.getText(), source.getName()));
		lexer.removeErrorListeners();
		lexer.addErrorListener(new SyntaxErrorListener(source));
		return lexer;
	}
}
