package org.metricshub.jformula.ast;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Objects;
import org.metricshub.jformula.context.EvaluationContext;
import org.metricshub.jformula.util.CompilerSettings;

/**
 * Emits the target-language code of a syntax tree.
 * <p>
 * An emitter is used for one tree and one context. It gives the nodes access
 * to their parent and children, to the compiler settings and to the optional
 * {@link EvaluationContext}.
 */
public final class CodeEmitter {

	private final AstGraph ast;
	private final EvaluationContext context;
	private final CompilerSettings settings;

	/**
	 * @param ast the tree to emit
	 * @param context the current cell and sheet, or {@code null}
	 * @param settings compiler settings, not modified
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The tree and the settings are only read during emission")
	public CodeEmitter(AstGraph ast, EvaluationContext context, CompilerSettings settings) {
		this.ast = Objects.requireNonNull(ast, "Syntax tree must not be null");
		this.context = context;
		this.settings = Objects.requireNonNull(settings, "Settings must not be null");
	}

	/**
	 * @return the code of the whole tree
	 */
	public String emit() {
		return emit(ast.getRoot());
	}

	/**
	 * @param node a node of the tree
	 * @return the code of the node and its descendants
	 */
	public String emit(AstNode node) {
		return node.emit(this);
	}

	public List<AstNode> getChildren(AstNode node) {
		return ast.getChildren(node);
	}

	public AstNode getParent(AstNode node) {
		return ast.getParent(node);
	}

	/**
	 * @return the evaluation context, or {@code null} when compiling without one
	 */
	public EvaluationContext getContext() {
		return context;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Nodes only read the settings")
	public CompilerSettings getSettings() {
		return settings;
	}
}
