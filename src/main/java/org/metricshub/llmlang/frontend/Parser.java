package org.metricshub.llmlang.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * LLM.lang
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;

/**
 * Recursive descent parser producing the syntax tree of an LLM.lang program.
 * <p>
 * One token of lookahead, no backtracking. The parser stops at the first
 * error. Grammar methods are named after the production they recognize and
 * each is preceded by its production in a comment.
 */
public class Parser {

	/** Names of the built-in parameter and variable types */
	public static final Set<String> TYPE_NAMES = Collections
			.unmodifiableSet(
					new HashSet<String>(Arrays.asList("Int", "Float", "String", "Bool", "List", "Map", "Vector", "Context")));

	/** Keys accepted by {@code @modify(...)} */
	public static final Set<String> MODIFY_KEYS = Collections
			.unmodifiableSet(
					new HashSet<String>(Arrays.asList("target", "operation", "path", "code", "position", "name", "value")));

	private static final Map<String, List<String>> MODIFY_REQUIRED_KEYS = new HashMap<String, List<String>>();

	static {
		MODIFY_REQUIRED_KEYS.put("replace", Arrays.asList("path", "code"));
		MODIFY_REQUIRED_KEYS.put("insert", Arrays.asList("path", "position", "code"));
		MODIFY_REQUIRED_KEYS.put("delete", Arrays.asList("path"));
		MODIFY_REQUIRED_KEYS.put("modify", Arrays.asList("path", "name", "value"));
	}

	/** Magnitude of the smallest Int, only valid right after a unary minus */
	static final String MIN_INT_MAGNITUDE = "9223372036854775808";

	private static final Set<String> COMPOUND_ASSIGNMENTS = new HashSet<String>(
			Arrays.asList("+=", "-=", "*=", "/=", "%="));

	private final List<Token> tokens;
	private int index;
	private Token token;
	private Token previous;

	/**
	 * Creates a parser over the output of {@link Lexer#tokenize()}.
	 *
	 * @param tokens tokens terminated by an EOF token
	 */
	public Parser(List<Token> tokens) {
		if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).getKind() != TokenKind.EOF) {
			throw new IllegalArgumentException("Token list must end with an EOF token");
		}
		this.tokens = tokens;
		this.index = 0;
		this.token = tokens.get(0);
		this.previous = token;
	}

	/**
	 * Lexes and parses a source string.
	 *
	 * @param source program text
	 * @param file description used in locations
	 * @return the {@link NodeKind#PROGRAM} node
	 */
	public static Node parse(String source, String file) {
		return new Parser(new Lexer(source, file).tokenize()).parse();
	}

	/**
	 * Parses the whole token list.
	 *
	 * @return the {@link NodeKind#PROGRAM} node
	 * @throws ParserException on the first syntax error
	 */
	public Node parse() {
		return PROGRAM();
	}

	// SUPPORTING METHODS

	private Token lexer() {
		previous = token;
		if (index < tokens.size() - 1) {
			index++;
		}
		token = tokens.get(index);
		return previous;
	}

	private Token lexer(TokenKind kind, String value) {
		if (!token.is(kind, value)) {
			throw parserException("Expected '" + value + "' but found " + token.describe(), "'" + value + "'");
		}
		return lexer();
	}

	private String identifier(String what) {
		if (token.getKind() != TokenKind.IDENTIFIER) {
			throw parserException("Expected " + what + " but found " + token.describe(), what);
		}
		return lexer().getValue();
	}

	private String stringLiteral(String what) {
		if (token.getKind() != TokenKind.STRING_LITERAL) {
			throw parserException("Expected " + what + " but found " + token.describe(), what);
		}
		return lexer().getValue();
	}

	private ParserException parserException(String msg, String expected) {
		ParserException.Kind kind = token.getKind() == TokenKind.EOF ? ParserException.Kind.UNEXPECTED_END_OF_INPUT
				: ParserException.Kind.UNEXPECTED_TOKEN;
		return new ParserException(kind, msg, token, expected);
	}

	private ParserException syntaxException(String msg) {
		return new ParserException(ParserException.Kind.INVALID_SYNTAX, msg, token, null);
	}

	private Node node(NodeKind kind, Token start) {
		return new Node(kind, start.getLocation().through(previous.getLocation()));
	}

	private Node node(NodeKind kind, Node start) {
		return new Node(kind, start.getLocation().through(previous.getLocation()));
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : ( CONTEXT | FUNCTION | STATEMENT )* EOF
	Node PROGRAM() {
		Token start = token;
		List<Node> items = new ArrayList<Node>();
		while (token.getKind() != TokenKind.EOF) {
			if (token.isKeyword("context")) {
				items.add(CONTEXT());
			} else if (token.isKeyword("fn")) {
				items.add(FUNCTION());
			} else {
				items.add(STATEMENT());
			}
		}
		Node program = node(NodeKind.PROGRAM, start);
		for (Node item : items) {
			program.addChild(item);
		}
		return program;
	}

	// CONTEXT : context IDENT { ( FUNCTION | VARIABLE )* }
	Node CONTEXT() {
		Token start = lexer(TokenKind.KEYWORD, "context");
		String name = identifier("context name");
		lexer(TokenKind.DELIMITER, "{");
		List<Node> members = new ArrayList<Node>();
		while (!token.isDelimiter("}")) {
			if (token.isKeyword("fn")) {
				members.add(FUNCTION());
			} else if (token.isKeyword("var")) {
				members.add(VARIABLE());
			} else {
				throw parserException("Unexpected token in context: " + token.describe(), "'fn' or 'var'");
			}
		}
		lexer(TokenKind.DELIMITER, "}");
		Node context = node(NodeKind.CONTEXT, start).setAttribute("name", name);
		for (Node member : members) {
			context.addChild(member);
		}
		return context;
	}

	// FUNCTION : fn IDENT ( [ PARAMETER ( , PARAMETER )* ] ) [ -> TYPE ] BLOCK
	Node FUNCTION() {
		Token start = lexer(TokenKind.KEYWORD, "fn");
		String name = identifier("function name");
		lexer(TokenKind.DELIMITER, "(");
		List<Node> parameters = new ArrayList<Node>();
		if (!token.isDelimiter(")")) {
			parameters.add(PARAMETER());
			while (token.isDelimiter(",")) {
				lexer();
				parameters.add(PARAMETER());
			}
		}
		lexer(TokenKind.DELIMITER, ")");
		String returnType = null;
		if (token.isOperator("->")) {
			lexer();
			returnType = TYPE();
		}
		Node body = BLOCK();
		Node function = node(NodeKind.FUNCTION, start).setAttribute("name", name);
		if (returnType != null) {
			function.setAttribute("return_type", returnType);
		}
		for (Node parameter : parameters) {
			function.addChild(parameter);
		}
		return function.addChild(body);
	}

	// PARAMETER : IDENT : TYPE
	Node PARAMETER() {
		Token start = token;
		String name = identifier("parameter name");
		lexer(TokenKind.DELIMITER, ":");
		String type = TYPE();
		return node(NodeKind.PARAMETER, start).setAttribute("name", name).setAttribute("type", type);
	}

	// TYPE : Int | Float | String | Bool | List | Map | Vector | Context | ~SEMANTIC~
	String TYPE() {
		if (token.getKind() == TokenKind.KEYWORD && TYPE_NAMES.contains(token.getValue())) {
			return lexer().getValue();
		}
		if (token.getKind() == TokenKind.SEMANTIC_TYPE) {
			return "~" + lexer().getValue() + "~";
		}
		throw parserException("Expected a type but found " + token.describe(), "type");
	}

	// BLOCK : { STATEMENT* }
	Node BLOCK() {
		Token start = lexer(TokenKind.DELIMITER, "{");
		List<Node> statements = new ArrayList<Node>();
		while (!token.isDelimiter("}")) {
			if (token.getKind() == TokenKind.EOF) {
				throw parserException("Expected '}' but found end of input", "'}'");
			}
			statements.add(STATEMENT());
		}
		lexer();
		Node block = node(NodeKind.BLOCK, start);
		for (Node statement : statements) {
			block.addChild(statement);
		}
		return block;
	}

	// STATEMENT : VARIABLE | IF | WHEN | FOR | RETURN | WITH | WITHIN | INTENT | PARALLEL
	// | APPLY | VECTOR | SEMANTIC | BLOCK | EXPRESSION ;
	Node STATEMENT() {
		if (token.getKind() == TokenKind.KEYWORD) {
			switch (token.getValue()) {
			case "var":
				return VARIABLE();
			case "if":
				return IF();
			case "when":
				return WHEN();
			case "for":
				return FOR();
			case "return":
				return RETURN();
			case "with":
				return WITH();
			case "within":
				return WITHIN();
			case "intent":
				return INTENT();
			case "parallel":
				return PARALLEL();
			case "apply":
				return APPLY();
			case "vector":
				return VECTOR();
			default:
				break;
			}
		}
		if (token.getKind() == TokenKind.SEMANTIC) {
			return SEMANTIC();
		}
		Token start = token;
		if (token.isDelimiter("{")) {
			Node block = BLOCK();
			return node(NodeKind.STATEMENT, start).addChild(block);
		}
		Node expression = EXPRESSION();
		lexer(TokenKind.DELIMITER, ";");
		return node(NodeKind.STATEMENT, start).addChild(expression);
	}

	// VARIABLE : var IDENT [ : TYPE ] = EXPRESSION ;
	Node VARIABLE() {
		Token start = lexer(TokenKind.KEYWORD, "var");
		String name = identifier("variable name");
		String type = null;
		if (token.isDelimiter(":")) {
			lexer();
			type = TYPE();
		}
		lexer(TokenKind.OPERATOR, "=");
		Node initializer = EXPRESSION();
		lexer(TokenKind.DELIMITER, ";");
		Node variable = node(NodeKind.VARIABLE, start).setAttribute("name", name);
		if (type != null) {
			variable.setAttribute("type", type);
		}
		return variable.addChild(initializer);
	}

	// IF : if ( EXPRESSION ) BLOCK [ else ( IF | BLOCK ) ]
	Node IF() {
		Token start = lexer(TokenKind.KEYWORD, "if");
		lexer(TokenKind.DELIMITER, "(");
		Node condition = EXPRESSION();
		lexer(TokenKind.DELIMITER, ")");
		Node thenBlock = BLOCK();
		Node elseBranch = null;
		if (token.isKeyword("else")) {
			lexer();
			elseBranch = token.isKeyword("if") ? IF() : BLOCK();
		}
		return node(NodeKind.IF, start).addChild(condition).addChild(thenBlock).addChild(elseBranch);
	}

	// WHEN : when ( EXPRESSION ) { ( ( EXPRESSION | otherwise ) => BLOCK )* }
	Node WHEN() {
		Token start = lexer(TokenKind.KEYWORD, "when");
		lexer(TokenKind.DELIMITER, "(");
		Node subject = EXPRESSION();
		lexer(TokenKind.DELIMITER, ")");
		lexer(TokenKind.DELIMITER, "{");
		List<Node> cases = new ArrayList<Node>();
		while (!token.isDelimiter("}")) {
			Token caseStart = token;
			Node pattern;
			if (token.isKeyword("otherwise")) {
				lexer();
				pattern = node(NodeKind.OTHERWISE, caseStart);
			} else {
				pattern = EXPRESSION();
			}
			lexer(TokenKind.OPERATOR, "=>");
			Node body = BLOCK();
			cases.add(node(NodeKind.CASE, caseStart).addChild(pattern).addChild(body));
		}
		lexer();
		Node when = node(NodeKind.WHEN, start).addChild(subject);
		for (Node whenCase : cases) {
			when.addChild(whenCase);
		}
		return when;
	}

	// FOR : for ( IDENT in EXPRESSION ) BLOCK
	Node FOR() {
		Token start = lexer(TokenKind.KEYWORD, "for");
		lexer(TokenKind.DELIMITER, "(");
		String variable = identifier("loop variable");
		lexer(TokenKind.KEYWORD, "in");
		Node collection = EXPRESSION();
		lexer(TokenKind.DELIMITER, ")");
		Node body = BLOCK();
		return node(NodeKind.FOR, start).setAttribute("variable", variable).addChild(collection).addChild(body);
	}

	// RETURN : return [ EXPRESSION ] ;
	Node RETURN() {
		Token start = lexer(TokenKind.KEYWORD, "return");
		Node value = null;
		if (!token.isDelimiter(";")) {
			value = EXPRESSION();
		}
		lexer(TokenKind.DELIMITER, ";");
		return node(NodeKind.RETURN, start).addChild(value);
	}

	// WITH : with context STRING BLOCK
	Node WITH() {
		Token start = lexer(TokenKind.KEYWORD, "with");
		lexer(TokenKind.KEYWORD, "context");
		String name = stringLiteral("context name");
		Node body = BLOCK();
		return node(NodeKind.WITH, start).setAttribute("name", name).addChild(body);
	}

	// WITHIN : within STRING BLOCK
	Node WITHIN() {
		Token start = lexer(TokenKind.KEYWORD, "within");
		String name = stringLiteral("context name");
		Node body = BLOCK();
		return node(NodeKind.WITHIN, start).setAttribute("name", name).addChild(body);
	}

	// INTENT : intent : EXPRESSION ;
	Node INTENT() {
		Token start = lexer(TokenKind.KEYWORD, "intent");
		lexer(TokenKind.DELIMITER, ":");
		Node intent = EXPRESSION();
		lexer(TokenKind.DELIMITER, ";");
		return node(NodeKind.INTENT, start).addChild(intent);
	}

	// PARALLEL : parallel { ( IDENT : BLOCK [ , ] )* } select STRATEGY ;
	Node PARALLEL() {
		Token start = lexer(TokenKind.KEYWORD, "parallel");
		lexer(TokenKind.DELIMITER, "{");
		List<Node> paths = new ArrayList<Node>();
		while (!token.isDelimiter("}")) {
			Token pathStart = token;
			String name = identifier("path name");
			lexer(TokenKind.DELIMITER, ":");
			Node body = BLOCK();
			paths.add(node(NodeKind.PATH, pathStart).setAttribute("name", name).addChild(body));
			if (token.isDelimiter(",")) {
				lexer();
			}
		}
		lexer();
		lexer(TokenKind.KEYWORD, "select");
		if (token.getKind() != TokenKind.KEYWORD && token.getKind() != TokenKind.IDENTIFIER) {
			throw parserException("Expected a selection strategy but found " + token.describe(), "strategy");
		}
		String strategy = lexer().getValue();
		lexer(TokenKind.DELIMITER, ";");
		Node parallel = node(NodeKind.PARALLEL, start).setAttribute("strategy", strategy);
		for (Node path : paths) {
			parallel.addChild(path);
		}
		return parallel;
	}

	// APPLY : apply EXPRESSION to BLOCK
	Node APPLY() {
		Token start = lexer(TokenKind.KEYWORD, "apply");
		Node vector = EXPRESSION();
		lexer(TokenKind.KEYWORD, "to");
		Node body = BLOCK();
		return node(NodeKind.APPLY, start).addChild(vector).addChild(body);
	}

	// VECTOR : vector IDENT = EXPRESSION ;
	Node VECTOR() {
		Token start = lexer(TokenKind.KEYWORD, "vector");
		String name = identifier("vector name");
		lexer(TokenKind.OPERATOR, "=");
		Node text = EXPRESSION();
		lexer(TokenKind.DELIMITER, ";");
		return node(NodeKind.VECTOR, start).setAttribute("name", name).addChild(text);
	}

	// SEMANTIC : @remember IDENT = EXPRESSION ;
	// | @recall [ ( STRING ) ] ;
	// | @modify ( KEY : STRING ( , KEY : STRING )* ) ;
	Node SEMANTIC() {
		Token start = token;
		String semanticToken = token.getValue();
		if ("@remember".equals(semanticToken)) {
			lexer();
			String name = identifier("memory key");
			lexer(TokenKind.OPERATOR, "=");
			Node value = EXPRESSION();
			lexer(TokenKind.DELIMITER, ";");
			return node(NodeKind.SEMANTIC, start)
					.setAttribute("token", semanticToken)
					.setAttribute("name", name)
					.addChild(value);
		}
		if ("@recall".equals(semanticToken)) {
			lexer();
			String key = null;
			if (token.isDelimiter("(")) {
				lexer();
				key = stringLiteral("memory key");
				lexer(TokenKind.DELIMITER, ")");
			}
			lexer(TokenKind.DELIMITER, ";");
			Node recall = node(NodeKind.SEMANTIC, start).setAttribute("token", semanticToken);
			return key == null ? recall : recall.setAttribute("key", key);
		}
		if ("@modify".equals(semanticToken)) {
			return MODIFY();
		}
		throw parserException("Unknown semantic token: " + semanticToken, "'@remember', '@recall' or '@modify'");
	}

	// MODIFY : @modify ( KEY : STRING ( , KEY : STRING )* ) ;
	Node MODIFY() {
		Token start = lexer();
		lexer(TokenKind.DELIMITER, "(");
		Map<String, String> arguments = new LinkedHashMap<String, String>();
		while (!token.isDelimiter(")")) {
			if (token.getKind() != TokenKind.IDENTIFIER && token.getKind() != TokenKind.KEYWORD) {
				throw parserException("Expected a modification key but found " + token.describe(), "modification key");
			}
			String key = token.getValue();
			if (!MODIFY_KEYS.contains(key)) {
				throw syntaxException("Unknown modification key: " + key);
			}
			if (arguments.containsKey(key)) {
				throw syntaxException("Duplicate modification key: " + key);
			}
			lexer();
			lexer(TokenKind.DELIMITER, ":");
			arguments.put(key, stringLiteral("string value for '" + key + "'"));
			if (!token.isDelimiter(")")) {
				lexer(TokenKind.DELIMITER, ",");
			}
		}
		lexer();
		lexer(TokenKind.DELIMITER, ";");
		if (!arguments.containsKey("target")) {
			throw syntaxException("@modify requires a 'target'");
		}
		String operation = arguments.get("operation");
		if (operation == null) {
			throw syntaxException("@modify requires an 'operation'");
		}
		List<String> required = MODIFY_REQUIRED_KEYS.get(operation);
		if (required == null) {
			throw syntaxException("Unknown modification operation: " + operation);
		}
		for (String key : required) {
			if (!arguments.containsKey(key)) {
				throw syntaxException("@modify operation '" + operation + "' requires '" + key + "'");
			}
		}
		Node modify = node(NodeKind.SEMANTIC, start).setAttribute("token", "@modify");
		for (Map.Entry<String, String> argument : arguments.entrySet()) {
			modify.setAttribute(argument.getKey(), argument.getValue());
		}
		return modify;
	}

	// EXPRESSION : ASSIGNMENT
	Node EXPRESSION() {
		return ASSIGNMENT();
	}

	// ASSIGNMENT : LOGICAL_OR [ ( = | += | -= | *= | /= | %= ) ASSIGNMENT ]
	Node ASSIGNMENT() {
		Node target = LOGICAL_OR();
		if (token.isOperator("=")) {
			lexer();
			Node value = ASSIGNMENT();
			return node(NodeKind.ASSIGNMENT, target).addChild(target).addChild(value);
		}
		if (token.getKind() == TokenKind.OPERATOR && COMPOUND_ASSIGNMENTS.contains(token.getValue())) {
			String operator = lexer().getValue().substring(0, 1);
			Node value = ASSIGNMENT();
			if (value.getKind() == NodeKind.ASSIGNMENT
					|| (value.getKind() == NodeKind.BINARY && !".".equals(value.getAttribute("operator")))) {
				// x *= 1 + 2 is x = x * (1 + 2)
				value = node(NodeKind.GROUPING, value).addChild(value);
			}
			Node binary = node(NodeKind.BINARY, target)
					.setAttribute("operator", operator)
					.addChild(target.deepCopy())
					.addChild(value);
			return node(NodeKind.ASSIGNMENT, target).addChild(target).addChild(binary);
		}
		return target;
	}

	// LOGICAL_OR : LOGICAL_AND ( ( or | || ) LOGICAL_AND )*
	Node LOGICAL_OR() {
		Node left = LOGICAL_AND();
		while (token.isKeyword("or") || token.isOperator("||")) {
			lexer();
			Node right = LOGICAL_AND();
			left = binary("or", left, right);
		}
		return left;
	}

	// LOGICAL_AND : EQUALITY ( ( and | && ) EQUALITY )*
	Node LOGICAL_AND() {
		Node left = EQUALITY();
		while (token.isKeyword("and") || token.isOperator("&&")) {
			lexer();
			Node right = EQUALITY();
			left = binary("and", left, right);
		}
		return left;
	}

	// EQUALITY : COMPARISON ( ( == | != ) COMPARISON )*
	Node EQUALITY() {
		Node left = COMPARISON();
		while (token.isOperator("==") || token.isOperator("!=")) {
			String operator = lexer().getValue();
			left = binary(operator, left, COMPARISON());
		}
		return left;
	}

	// COMPARISON : TERM ( ( < | > | <= | >= ) TERM )*
	Node COMPARISON() {
		Node left = TERM();
		while (token.isOperator("<") || token.isOperator(">") || token.isOperator("<=") || token.isOperator(">=")) {
			String operator = lexer().getValue();
			left = binary(operator, left, TERM());
		}
		return left;
	}

	// TERM : FACTOR ( ( + | - ) FACTOR )*
	Node TERM() {
		Node left = FACTOR();
		while (token.isOperator("+") || token.isOperator("-")) {
			String operator = lexer().getValue();
			left = binary(operator, left, FACTOR());
		}
		return left;
	}

	// FACTOR : UNARY ( ( * | / | % ) UNARY )*
	Node FACTOR() {
		Node left = UNARY();
		while (token.isOperator("*") || token.isOperator("/") || token.isOperator("%")) {
			String operator = lexer().getValue();
			left = binary(operator, left, UNARY());
		}
		return left;
	}

	// UNARY : ( - | ! | not ) UNARY | CALL
	Node UNARY() {
		if (token.isOperator("-") || token.isOperator("!") || token.isKeyword("not")) {
			Token start = lexer();
			String operator = start.isKeyword("not") ? "!" : start.getValue();
			if ("-".equals(operator) && isMinIntMagnitude(token)) {
				lexer();
				return literal("Int", "-" + MIN_INT_MAGNITUDE, start);
			}
			Node operand = UNARY();
			return node(NodeKind.UNARY, start).setAttribute("operator", operator).addChild(operand);
		}
		return CALL();
	}

	// CALL : PRIMARY ( ( [ EXPRESSION ( , EXPRESSION )* ] ) | . IDENT )*
	Node CALL() {
		Node expression = PRIMARY();
		while (true) {
			if (token.isDelimiter("(")) {
				lexer();
				List<Node> arguments = new ArrayList<Node>();
				if (!token.isDelimiter(")")) {
					arguments.add(EXPRESSION());
					while (token.isDelimiter(",")) {
						lexer();
						arguments.add(EXPRESSION());
					}
				}
				lexer(TokenKind.DELIMITER, ")");
				Node call = node(NodeKind.CALL, expression).addChild(expression);
				for (Node argument : arguments) {
					call.addChild(argument);
				}
				expression = call;
			} else if (token.isDelimiter(".")) {
				lexer();
				if (token.getKind() != TokenKind.IDENTIFIER && token.getKind() != TokenKind.KEYWORD) {
					throw parserException("Expected property name but found " + token.describe(), "property name");
				}
				String name = lexer().getValue();
				expression = node(NodeKind.BINARY, expression)
						.setAttribute("operator", ".")
						.setAttribute("name", name)
						.addChild(expression);
			} else {
				return expression;
			}
		}
	}

	// PRIMARY : true | false | null | INT | FLOAT | STRING | NATURAL_LANGUAGE | IDENT
	// | ( EXPRESSION ) | [ [ EXPRESSION ( , EXPRESSION )* ] ]
	Node PRIMARY() {
		Token start = token;
		switch (token.getKind()) {
		case INT_LITERAL:
			if (isMinIntMagnitude(token)) {
				throw syntaxException("Integer out of range: " + token.getValue());
			}
			return literal("Int", lexer().getValue(), start);
		case FLOAT_LITERAL:
			return literal("Float", lexer().getValue(), start);
		case STRING_LITERAL:
			return literal("String", lexer().getValue(), start);
		case NATURAL_LANGUAGE:
			return node(NodeKind.NATURAL_LANGUAGE, lexer()).setAttribute("value", start.getValue());
		case IDENTIFIER:
			return node(NodeKind.IDENTIFIER, lexer()).setAttribute("name", start.getValue());
		case KEYWORD:
			if (token.isKeyword("true") || token.isKeyword("false")) {
				return literal("Bool", lexer().getValue(), start);
			}
			if (token.isKeyword("null")) {
				return literal("Null", lexer().getValue(), start);
			}
			break;
		case DELIMITER:
			if (token.isDelimiter("(")) {
				lexer();
				Node inner = EXPRESSION();
				lexer(TokenKind.DELIMITER, ")");
				return node(NodeKind.GROUPING, start).addChild(inner);
			}
			if (token.isDelimiter("[")) {
				return LIST();
			}
			break;
		default:
			break;
		}
		throw parserException("Unexpected token: " + token.describe(), "expression");
	}

	// LIST : [ [ EXPRESSION ( , EXPRESSION )* ] ]
	Node LIST() {
		Token start = lexer(TokenKind.DELIMITER, "[");
		List<Node> elements = new ArrayList<Node>();
		if (!token.isDelimiter("]")) {
			elements.add(EXPRESSION());
			while (token.isDelimiter(",")) {
				lexer();
				elements.add(EXPRESSION());
			}
		}
		lexer(TokenKind.DELIMITER, "]");
		Node list = node(NodeKind.LIST, start);
		for (Node element : elements) {
			list.addChild(element);
		}
		return list;
	}

	// CHECKSTYLE.ON: MethodName

	private Node binary(String operator, Node left, Node right) {
		return node(NodeKind.BINARY, left).setAttribute("operator", operator).addChild(left).addChild(right);
	}

	/**
	 * @return whether {@code candidate} is the Int literal 2^63, which the
	 *         lexer lets through for {@code -9223372036854775808}
	 */
	private static boolean isMinIntMagnitude(Token candidate) {
		if (candidate.getKind() != TokenKind.INT_LITERAL) {
			return false;
		}
		try {
			Long.parseLong(candidate.getValue());
			return false;
		} catch (NumberFormatException e) {
			return true;
		}
	}

	private Node literal(String type, String value, Token start) {
		return node(NodeKind.LITERAL, start).setAttribute("type", type).setAttribute("value", value);
	}
}
