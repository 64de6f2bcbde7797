package org.metricshub.jformula;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jformula
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.List;
import org.metricshub.jformula.ast.AstBuilder;
import org.metricshub.jformula.ast.AstGraph;
import org.metricshub.jformula.ast.AstNode;
import org.metricshub.jformula.ast.CodeEmitter;
import org.metricshub.jformula.context.EvaluationContext;
import org.metricshub.jformula.frontend.FormulaLexer;
import org.metricshub.jformula.frontend.FormulaParser;
import org.metricshub.jformula.frontend.Token;
import org.metricshub.jformula.util.CompilerSettings;
import org.metricshub.jformula.util.FormulaLogger;
import org.slf4j.Logger;

/**
 * Entry point into the compilation of spreadsheet formulas.
 * <p>
 * The overall process to compile a formula is as follows:
 * <ul>
 * <li>Tokenize the formula, turning meaningful blanks into intersection operators.
 * <li>Convert the tokens to postfix order with the shunting-yard algorithm,
 * counting the arguments of each function call.
 * <li>Reduce the postfix sequence into a syntax tree.
 * <li>Emit the target-language code of the tree, children first.
 * </ul>
 * Each stage is also available on its own. A compiler keeps no state between
 * calls and may be shared between threads, as long as the evaluation contexts
 * are not.
 * <p>
 * Any problem aborts the compilation with a
 * {@link org.metricshub.jformula.frontend.ParserException}.
 */
public class FormulaCompiler {

	private static final Logger LOGGER = FormulaLogger.getLogger(FormulaCompiler.class);

	private final CompilerSettings settings;

	/**
	 * Create a new compiler with the default settings
	 */
	public FormulaCompiler() {
		this(new CompilerSettings());
	}

	/**
	 * Create a new compiler with a copy of the specified settings.
	 *
	 * @param settings compiler settings
	 */
	public FormulaCompiler(CompilerSettings settings) {
		this.settings = new CompilerSettings(settings);
	}

	/**
	 * @return a copy of the settings of this compiler
	 */
	public CompilerSettings getSettings() {
		return new CompilerSettings(settings);
	}

	/**
	 * @param formula the formula to tokenize
	 * @return the tokens of the formula
	 */
	public List<Token> tokenize(String formula) {
		return FormulaLexer.tokenize(formula);
	}

	/**
	 * @param formula the formula to parse
	 * @return the syntax tree nodes of the formula in postfix order
	 */
	public List<AstNode> parseToPostfix(String formula) {
		return FormulaParser.parseToPostfix(tokenize(formula));
	}

	/**
	 * @param formula the formula to parse
	 * @return the syntax tree of the formula
	 */
	public AstGraph buildAst(String formula) {
		return AstBuilder.build(parseToPostfix(formula));
	}

	/**
	 * Compiles the specified formula without evaluation context: references
	 * are left unqualified and regression positions are unknown.
	 *
	 * @param formula the formula to compile
	 * @return the compiled formula
	 */
	public CompiledFormula compile(String formula) {
		return compile(formula, null);
	}

	/**
	 * Compiles the specified formula.
	 *
	 * @param formula the formula to compile
	 * @param context the cell the formula belongs to, or {@code null}
	 * @return the compiled formula
	 */
	public CompiledFormula compile(String formula, EvaluationContext context) {
		LOGGER.debug("Compiling {} in {}", formula, context);
		AstGraph ast = buildAst(formula);
		String code = emit(ast, context);
		LOGGER.debug("Compiled {} to {}", formula, code);
		return new CompiledFormula(formula, code, ast, settings.getAddressSyntax());
	}

	/**
	 * Emits the code of an already built syntax tree.
	 *
	 * @param ast the syntax tree
	 * @param context the cell the formula belongs to, or {@code null}
	 * @return the target-language code
	 */
	public String emit(AstGraph ast, EvaluationContext context) {
		return new CodeEmitter(ast, context, settings).emit();
	}
}
