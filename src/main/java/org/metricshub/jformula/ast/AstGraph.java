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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jformula.frontend.ParserException;

/**
 * Syntax tree of a formula, stored as a graph whose edges go from a child to
 * its parent.
 * <p>
 * Each edge carries the position of the child in the operand or argument
 * list of its parent, and children are always returned in that order.
 * A node has at most one parent, and the root is the only node without one.
 */
public final class AstGraph {

	private static final class Edge {
		private final AstNode child;
		private final AstNode parent;
		private final int pos;

		private Edge(AstNode child, AstNode parent, int pos) {
			this.child = child;
			this.parent = parent;
			this.pos = pos;
		}
	}

	private static final Comparator<Edge> BY_POSITION = Comparator.comparingInt(edge -> edge.pos);

	private final Set<AstNode> nodes = new LinkedHashSet<AstNode>();
	private final Map<AstNode, Edge> outgoing = new HashMap<AstNode, Edge>();
	private final Map<AstNode, List<Edge>> incoming = new HashMap<AstNode, List<Edge>>();
	private AstNode root;

	AstGraph() {}

	void addNode(AstNode node) {
		nodes.add(node);
	}

	void addEdge(AstNode child, AstNode parent, int pos) {
		if (outgoing.containsKey(child)) {
			throw new ParserException(child + " already has a parent");
		}
		addNode(child);
		addNode(parent);
		Edge edge = new Edge(child, parent, pos);
		outgoing.put(child, edge);
		incoming.computeIfAbsent(parent, key -> new ArrayList<Edge>()).add(edge);
	}

	void setRoot(AstNode root) {
		if (outgoing.containsKey(root)) {
			throw new ParserException(root + " cannot be the root, it has a parent");
		}
		this.root = root;
	}

	/**
	 * @return the root of the tree: the node evaluated last
	 */
	public AstNode getRoot() {
		return root;
	}

	/**
	 * @param node a node of this tree
	 * @return the operands or arguments of the node, in source order
	 */
	public List<AstNode> getChildren(AstNode node) {
		List<Edge> edges = incoming.get(node);
		if (edges == null) {
			return Collections.emptyList();
		}
		List<Edge> sorted = new ArrayList<Edge>(edges);
		sorted.sort(BY_POSITION);
		List<AstNode> children = new ArrayList<AstNode>(sorted.size());
		for (Edge edge : sorted) {
			children.add(edge.child);
		}
		return children;
	}

	/**
	 * @param node a node of this tree
	 * @return the parent of the node, or {@code null} for the root
	 */
	public AstNode getParent(AstNode node) {
		Edge edge = outgoing.get(node);
		return edge == null ? null : edge.parent;
	}

	/**
	 * @param node a node of this tree
	 * @return position of the node among the children of its parent, or {@code -1} for the root
	 */
	public int getPosition(AstNode node) {
		Edge edge = outgoing.get(node);
		return edge == null ? -1 : edge.pos;
	}

	/**
	 * @param node a node of this tree
	 * @return all the nodes below the specified one, depth first, in source order
	 */
	public List<AstNode> getDescendants(AstNode node) {
		List<AstNode> descendants = new ArrayList<AstNode>();
		collectDescendants(node, descendants);
		return descendants;
	}

	private void collectDescendants(AstNode node, List<AstNode> descendants) {
		for (AstNode child : getChildren(node)) {
			descendants.add(child);
			collectDescendants(child, descendants);
		}
	}

	/**
	 * @return all the nodes of the tree, in the order they were added
	 */
	public List<AstNode> getNodes() {
		return Collections.unmodifiableList(new ArrayList<AstNode>(nodes));
	}

	/**
	 * Dump a meaningful text representation of this tree to the specified
	 * print stream, one node per line, indented by depth.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		if (root != null) {
			dump(ps, root, 0);
		}
	}

	private void dump(PrintStream ps, AstNode node, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces.toString() + node);
		for (AstNode child : getChildren(node)) {
			dump(ps, child, lvl + 1);
		}
	}
}
