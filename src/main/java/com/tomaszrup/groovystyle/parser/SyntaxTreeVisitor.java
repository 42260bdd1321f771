////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovystyle.parser;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ClassCodeVisitorSupport;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.FieldNode;
import org.codehaus.groovy.ast.MethodNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.PackageNode;
import org.codehaus.groovy.ast.PropertyNode;
import org.codehaus.groovy.ast.expr.ArrayExpression;
import org.codehaus.groovy.ast.expr.AttributeExpression;
import org.codehaus.groovy.ast.expr.BinaryExpression;
import org.codehaus.groovy.ast.expr.BitwiseNegationExpression;
import org.codehaus.groovy.ast.expr.CastExpression;
import org.codehaus.groovy.ast.expr.ClassExpression;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.ConstructorCallExpression;
import org.codehaus.groovy.ast.expr.DeclarationExpression;
import org.codehaus.groovy.ast.expr.ElvisOperatorExpression;
import org.codehaus.groovy.ast.expr.EmptyExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.GStringExpression;
import org.codehaus.groovy.ast.expr.LambdaExpression;
import org.codehaus.groovy.ast.expr.ListExpression;
import org.codehaus.groovy.ast.expr.MapEntryExpression;
import org.codehaus.groovy.ast.expr.MapExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.MethodPointerExpression;
import org.codehaus.groovy.ast.expr.NotExpression;
import org.codehaus.groovy.ast.expr.PostfixExpression;
import org.codehaus.groovy.ast.expr.PrefixExpression;
import org.codehaus.groovy.ast.expr.PropertyExpression;
import org.codehaus.groovy.ast.expr.RangeExpression;
import org.codehaus.groovy.ast.expr.SpreadExpression;
import org.codehaus.groovy.ast.expr.SpreadMapExpression;
import org.codehaus.groovy.ast.expr.StaticMethodCallExpression;
import org.codehaus.groovy.ast.expr.TernaryExpression;
import org.codehaus.groovy.ast.expr.TupleExpression;
import org.codehaus.groovy.ast.expr.UnaryMinusExpression;
import org.codehaus.groovy.ast.expr.UnaryPlusExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.ast.stmt.ReturnStatement;
import org.codehaus.groovy.ast.stmt.Statement;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.syntax.Types;

import com.tomaszrup.groovystyle.source.SourceText;
import com.tomaszrup.groovystyle.tree.ChildRole;
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxTree;
import com.tomaszrup.groovystyle.tree.SyntaxTreeBuilder;

/**
 * Walks a Groovy {@link ModuleNode} and records the nodes the style rules
 * care about in a {@link SyntaxTree} arena.
 *
 * <p>Only nodes carrying a source position are recorded; the children of an
 * unpositioned node attach to the closest recorded ancestor. A child's
 * {@link ChildRole} is announced by {@link #visitChild} right before it is
 * visited and consumed when that exact node is pushed, so wrapper nodes
 * that are not recorded never pass a role on to their descendants.</p>
 */
class SyntaxTreeVisitor extends ClassCodeVisitorSupport {

	private final SourceText source;
	private final SyntaxTreeBuilder builder;
	private final Deque<Integer> stack = new ArrayDeque<>();
	private final Set<FieldNode> visitedFields = Collections.newSetFromMap(new IdentityHashMap<>());
	private SourceUnit sourceUnit;

	private ASTNode pendingNode;
	private ChildRole pendingRole;

	SyntaxTreeVisitor(SourceText source) {
		this.source = source;
		this.builder = new SyntaxTreeBuilder(source.length());
	}

	@Override
	protected SourceUnit getSourceUnit() {
		return sourceUnit;
	}

	SyntaxTree visitModule(ModuleNode module) {
		sourceUnit = module.getContext();
		stack.addLast(builder.getRootIndex());
		try {
			BlockStatement statements = module.getStatementBlock();
			if (statements != null) {
				statements.visit(this);
			}
			for (MethodNode method : module.getMethods()) {
				visitMethod(method);
			}
			for (ClassNode classNode : module.getClasses()) {
				// the script class only wraps the statement block and methods above
				if (!classNode.isScript()) {
					visitClass(classNode);
				}
			}
		} finally {
			stack.removeLast();
		}
		return builder.build();
	}

	// arena bookkeeping

	private int pushASTNode(ASTNode node, SyntaxKind kind) {
		ChildRole role = ChildRole.CHILD;
		if (pendingNode == node) {
			role = pendingRole;
			pendingNode = null;
		}
		int start = offset(node.getLineNumber(), node.getColumnNumber());
		int end = offset(node.getLastLineNumber(), node.getLastColumnNumber());
		if (start < 0 || end < start) {
			return -1;
		}
		int index = builder.addNode(kind, start, end, stack.peekLast(), role);
		stack.addLast(index);
		return index;
	}

	private void popASTNode(int index) {
		if (index >= 0) {
			stack.removeLast();
		}
	}

	private int offset(int line, int column) {
		if (line < 1 || column < 1 || line > source.getLineCount()) {
			return -1;
		}
		return source.offsetOf(line, column - 1);
	}

	private void visitChild(Expression expression, ChildRole role) {
		if (expression == null || expression instanceof EmptyExpression) {
			return;
		}
		pendingNode = expression;
		pendingRole = role;
		try {
			expression.visit(this);
		} finally {
			pendingNode = null;
		}
	}

	private void visitChild(Statement statement, ChildRole role) {
		if (statement == null) {
			return;
		}
		pendingNode = statement;
		pendingRole = role;
		try {
			statement.visit(this);
		} finally {
			pendingNode = null;
		}
	}

	private void visitArguments(Expression arguments) {
		if (arguments instanceof TupleExpression) {
			for (Expression argument : ((TupleExpression) arguments).getExpressions()) {
				visitChild(argument, ChildRole.ARGUMENT);
			}
		} else {
			visitChild(arguments, ChildRole.ARGUMENT);
		}
	}

	private void visitOther(Expression node, Runnable children) {
		int index = pushASTNode(node, SyntaxKind.OTHER);
		try {
			children.run();
		} finally {
			popASTNode(index);
		}
	}

	// GroovyClassVisitor

	@Override
	public void visitClass(ClassNode node) {
		int index = pushASTNode(node, SyntaxKind.CLASS);
		try {
			super.visitClass(node);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitPackage(PackageNode node) {
		// package annotations carry nothing the rules inspect
	}

	@Override
	public void visitImports(ModuleNode node) {
		// visitClass would otherwise revisit the imports once per class
	}

	@Override
	protected void visitConstructorOrMethod(MethodNode node, boolean isConstructor) {
		int index = pushASTNode(node, SyntaxKind.METHOD);
		try {
			super.visitConstructorOrMethod(node, isConstructor);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitField(FieldNode node) {
		if (node.isEnum() || node.isSynthetic()) {
			return;
		}
		visitFieldInitializer(node, node);
	}

	@Override
	public void visitProperty(PropertyNode node) {
		// at CONVERSION the backing field is not listed on the class yet
		FieldNode field = node.getField();
		if (field == null) {
			return;
		}
		visitFieldInitializer(field, field.getLineNumber() > 0 ? field : node);
	}

	private void visitFieldInitializer(FieldNode field, ASTNode positioned) {
		if (!visitedFields.add(field)) {
			return;
		}
		Expression initial = field.getInitialValueExpression();
		if (initial == null) {
			visitAnnotations(field);
			return;
		}
		int index = pushASTNode(positioned, SyntaxKind.FIELD_INITIALIZER);
		try {
			visitAnnotations(field);
			visitChild(initial, ChildRole.VALUE);
		} finally {
			popASTNode(index);
		}
	}

	// GroovyCodeVisitor: statements

	@Override
	public void visitBlockStatement(BlockStatement node) {
		int index = pushASTNode(node, SyntaxKind.BLOCK);
		try {
			super.visitBlockStatement(node);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitExpressionStatement(ExpressionStatement node) {
		int index = pushASTNode(node, SyntaxKind.STATEMENT);
		try {
			super.visitExpressionStatement(node);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitReturnStatement(ReturnStatement node) {
		int index = pushASTNode(node, SyntaxKind.STATEMENT);
		try {
			super.visitReturnStatement(node);
		} finally {
			popASTNode(index);
		}
	}

	// GroovyCodeVisitor: assignments and operators

	@Override
	public void visitDeclarationExpression(DeclarationExpression node) {
		int index = pushASTNode(node, SyntaxKind.VARIABLE_BINDING);
		try {
			if (index >= 0) {
				builder.setOperator(index, node.getOperation().getText());
			}
			visitChild(node.getLeftExpression(), ChildRole.TARGET);
			visitChild(node.getRightExpression(), ChildRole.VALUE);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitBinaryExpression(BinaryExpression node) {
		int type = node.getOperation().getType();
		boolean assignment = Types.isAssignment(type);
		SyntaxKind kind;
		if (assignment) {
			kind = SyntaxKind.ASSIGNMENT;
		} else if (type == Types.LEFT_SQUARE_BRACKET) {
			kind = SyntaxKind.OTHER;
		} else {
			kind = SyntaxKind.BINARY;
		}
		int index = pushASTNode(node, kind);
		try {
			if (index >= 0) {
				builder.setOperator(index, node.getOperation().getText());
			}
			visitChild(node.getLeftExpression(), assignment ? ChildRole.TARGET : ChildRole.LEFT);
			visitChild(node.getRightExpression(), assignment ? ChildRole.VALUE : ChildRole.RIGHT);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitTernaryExpression(TernaryExpression node) {
		int index = pushASTNode(node, SyntaxKind.CONDITIONAL);
		try {
			visitChild(node.getBooleanExpression().getExpression(), ChildRole.TEST);
			visitChild(node.getTrueExpression(), ChildRole.CONSEQUENT);
			visitChild(node.getFalseExpression(), ChildRole.ALTERNATE);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitShortTernaryExpression(ElvisOperatorExpression node) {
		visitOther(node, () -> {
			visitChild(node.getTrueExpression(), ChildRole.LEFT);
			visitChild(node.getFalseExpression(), ChildRole.RIGHT);
		});
	}

	@Override
	public void visitNotExpression(NotExpression node) {
		visitUnary(node, "!", node.getExpression());
	}

	@Override
	public void visitUnaryMinusExpression(UnaryMinusExpression node) {
		visitUnary(node, "-", node.getExpression());
	}

	@Override
	public void visitUnaryPlusExpression(UnaryPlusExpression node) {
		visitUnary(node, "+", node.getExpression());
	}

	@Override
	public void visitBitwiseNegationExpression(BitwiseNegationExpression node) {
		visitUnary(node, "~", node.getExpression());
	}

	private void visitUnary(Expression node, String operator, Expression operand) {
		int index = pushASTNode(node, SyntaxKind.UNARY);
		try {
			if (index >= 0) {
				builder.setOperator(index, operator);
			}
			visitChild(operand, ChildRole.OPERAND);
		} finally {
			popASTNode(index);
		}
	}

	// GroovyCodeVisitor: lambdas and closures

	@Override
	public void visitClosureExpression(ClosureExpression node) {
		if (node instanceof LambdaExpression) {
			visitLambda((LambdaExpression) node);
			return;
		}
		int index = pushASTNode(node, SyntaxKind.CLOSURE);
		try {
			super.visitClosureExpression(node);
		} finally {
			popASTNode(index);
		}
	}

	private void visitLambda(LambdaExpression node) {
		int index = pushASTNode(node, SyntaxKind.LAMBDA);
		try {
			Statement code = node.getCode();
			if (code instanceof ExpressionStatement) {
				visitChild(((ExpressionStatement) code).getExpression(), ChildRole.BODY);
			} else if (code instanceof BlockStatement && !startsWithBrace(code)
					&& ((BlockStatement) code).getStatements().size() == 1
					&& ((BlockStatement) code).getStatements().get(0) instanceof ExpressionStatement) {
				ExpressionStatement only = (ExpressionStatement) ((BlockStatement) code).getStatements().get(0);
				visitChild(only.getExpression(), ChildRole.BODY);
			} else {
				visitChild(code, ChildRole.BODY);
			}
		} finally {
			popASTNode(index);
		}
	}

	private boolean startsWithBrace(ASTNode node) {
		int start = offset(node.getLineNumber(), node.getColumnNumber());
		return start >= 0 && start < source.length() && source.getText().charAt(start) == '{';
	}

	// GroovyCodeVisitor: literals

	@Override
	public void visitListExpression(ListExpression node) {
		int index = pushASTNode(node, SyntaxKind.ARRAY_LITERAL);
		try {
			for (Expression element : node.getExpressions()) {
				visitChild(element, ChildRole.ELEMENT);
			}
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitMapExpression(MapExpression node) {
		int index = pushASTNode(node, SyntaxKind.OBJECT_LITERAL);
		try {
			for (MapEntryExpression entry : node.getMapEntryExpressions()) {
				visitChild(entry, ChildRole.MEMBER);
			}
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitMapEntryExpression(MapEntryExpression node) {
		int index = pushASTNode(node, SyntaxKind.PROPERTY);
		try {
			visitChild(node.getKeyExpression(), ChildRole.KEY);
			visitChild(node.getValueExpression(), ChildRole.VALUE);
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitConstantExpression(ConstantExpression node) {
		int index = pushASTNode(node, SyntaxKind.LITERAL);
		try {
			if (index >= 0) {
				Object value = node.getValue();
				boolean scalar = value == null || value instanceof String || value instanceof Number
						|| value instanceof Boolean || value instanceof Character;
				builder.setLiteral(index, String.valueOf(value), scalar);
			}
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitGStringExpression(GStringExpression node) {
		int index = pushASTNode(node, SyntaxKind.TEMPLATE);
		try {
			if (index >= 0) {
				builder.setTemplate(index, node.getValues().size(), node.getStrings().size());
			}
			for (Expression value : node.getValues()) {
				visitChild(value, ChildRole.CHILD);
			}
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitVariableExpression(VariableExpression node) {
		int index = pushASTNode(node, SyntaxKind.IDENTIFIER);
		try {
			if (index >= 0) {
				builder.setName(index, node.getName());
			}
		} finally {
			popASTNode(index);
		}
	}

	// GroovyCodeVisitor: calls and member access

	@Override
	public void visitMethodCallExpression(MethodCallExpression node) {
		int index = pushASTNode(node, SyntaxKind.CALL);
		try {
			if (!node.isImplicitThis()) {
				visitChild(node.getObjectExpression(), ChildRole.RECEIVER);
			}
			visitChild(node.getMethod(), ChildRole.CHILD);
			visitArguments(node.getArguments());
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitStaticMethodCallExpression(StaticMethodCallExpression node) {
		int index = pushASTNode(node, SyntaxKind.CALL);
		try {
			visitArguments(node.getArguments());
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitConstructorCallExpression(ConstructorCallExpression node) {
		int index = pushASTNode(node, SyntaxKind.CALL);
		try {
			visitArguments(node.getArguments());
		} finally {
			popASTNode(index);
		}
	}

	@Override
	public void visitPropertyExpression(PropertyExpression node) {
		visitMemberAccess(node);
	}

	@Override
	public void visitAttributeExpression(AttributeExpression node) {
		visitMemberAccess(node);
	}

	private void visitMemberAccess(PropertyExpression node) {
		int index = pushASTNode(node, SyntaxKind.MEMBER_ACCESS);
		try {
			visitChild(node.getObjectExpression(), ChildRole.RECEIVER);
			visitChild(node.getProperty(), ChildRole.CHILD);
		} finally {
			popASTNode(index);
		}
	}

	// GroovyCodeVisitor: everything else is recorded as OTHER

	@Override
	public void visitCastExpression(CastExpression node) {
		visitOther(node, () -> super.visitCastExpression(node));
	}

	@Override
	public void visitRangeExpression(RangeExpression node) {
		visitOther(node, () -> super.visitRangeExpression(node));
	}

	@Override
	public void visitPostfixExpression(PostfixExpression node) {
		visitOther(node, () -> super.visitPostfixExpression(node));
	}

	@Override
	public void visitPrefixExpression(PrefixExpression node) {
		visitOther(node, () -> super.visitPrefixExpression(node));
	}

	@Override
	public void visitMethodPointerExpression(MethodPointerExpression node) {
		visitOther(node, () -> super.visitMethodPointerExpression(node));
	}

	@Override
	public void visitClassExpression(ClassExpression node) {
		visitOther(node, () -> super.visitClassExpression(node));
	}

	@Override
	public void visitArrayExpression(ArrayExpression node) {
		visitOther(node, () -> super.visitArrayExpression(node));
	}

	@Override
	public void visitSpreadExpression(SpreadExpression node) {
		visitOther(node, () -> super.visitSpreadExpression(node));
	}

	@Override
	public void visitSpreadMapExpression(SpreadMapExpression node) {
		visitOther(node, () -> super.visitSpreadMapExpression(node));
	}
}
