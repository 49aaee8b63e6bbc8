package ctc.parser;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateArgument;
import ctc.model.template.TemplateDeclaration;
import ctc.model.template.TemplateFieldReference;
import ctc.model.template.TemplateKeyReference;
import ctc.model.template.TemplateReference;
import ctc.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for Cubicle templates.
 *
 * A template declaration and a name may both start with "@". Positions that accept both first
 * try the declaration, and keep it only if it is followed by what an iterator or a replicated
 * construct expects; otherwise they backtrack and read a name.
 */
public final class CubicleTemplateParser {

	private static final Pattern FRAGMENT = Pattern.compile("[A-Za-z0-9_]+");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	private static final Pattern INTEGER = Pattern.compile("[0-9]+");
	private static final Pattern NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?(?![A-Za-z0-9_])");
	private static final Pattern BOOLEAN = Pattern.compile("(True|False)(?![A-Za-z0-9_])");
	private static final Pattern TEMPLATE_REFERENCE =
			Pattern.compile("([0-9]+)(\\.([A-Za-z_][A-Za-z0-9_]*))?|([A-Za-z_][A-Za-z0-9_]*)");
	private static final Pattern COMPARISON_OPERATOR = Pattern.compile("<>|<=|<|>=|>|=");
	private static final Pattern ARITHMETIC_OPERATOR = Pattern.compile("[+-]");

	private final LexicalContext ctx;

	private CubicleTemplateParser(LexicalContext ctx) {
		this.ctx = ctx;
	}

	public static CubicleModel readModel(Path filePath, CharSequence chars) throws TemplateParseException {
		CubicleTemplateParser parser = new CubicleTemplateParser(new LexicalContext(filePath, chars));
		CubicleModel model = parser.model();
		parser.expectEOF();
		return model;
	}

	public static CubicleOrExpression readOrExpression(Path filePath, CharSequence chars)
			throws TemplateParseException {
		CubicleTemplateParser parser = new CubicleTemplateParser(new LexicalContext(filePath, chars));
		CubicleOrExpression expression = parser.orExpression();
		parser.expectEOF();
		return expression;
	}

	private TemplateParseException error(String message) {
		return new TemplateParseException(message, ctx.getLine(), ctx.getColumn());
	}

	private void expectEOF() {
		skipWhitespace();
		if (!ctx.isEOF()) {
			throw error("unexpected input");
		}
	}

	private static boolean isNameChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
	}

	// comments nest: (* a (* b *) c *)
	private void skipComment() {
		int line = ctx.getLine();
		int column = ctx.getColumn();
		ctx.matchString("(*");
		int level = 1;
		while (level > 0) {
			if (ctx.isEOF()) {
				throw new TemplateParseException("unterminated comment", line, column);
			}
			if (ctx.matchString("(*")) {
				++level;
			} else if (ctx.matchString("*)")) {
				--level;
			} else {
				ctx.skip();
			}
		}
	}

	private void skipWhitespace() {
		while (true) {
			if (Character.isWhitespace(ctx.peek())) {
				ctx.skip();
			} else if (ctx.lookingAt("(*")) {
				skipComment();
			} else {
				return;
			}
		}
	}

	private boolean symbol(String symbol) {
		skipWhitespace();
		return ctx.matchString(symbol);
	}

	private void expectSymbol(String symbol) {
		if (!symbol(symbol)) {
			throw error("expected \"" + symbol + "\"");
		}
	}

	/**
	 * Matches a single "|", never the first half of "||".
	 */
	private boolean bar() {
		skipWhitespace();
		if (ctx.lookingAt("||")) {
			return false;
		}
		return ctx.matchString("|");
	}

	private boolean keyword(String keyword) {
		skipWhitespace();
		LexicalContext.Mark mark = ctx.mark();
		if (ctx.matchString(keyword) && !isNameChar(ctx.peek())) {
			return true;
		}
		ctx.restore(mark);
		return false;
	}

	private void expectKeyword(String keyword) {
		if (!keyword(keyword)) {
			throw error("expected \"" + keyword + "\"");
		}
	}

	private String identifier(String what) {
		skipWhitespace();
		return ctx.matchPattern(IDENTIFIER).orElseThrow(() -> error("expected " + what)).group();
	}

	private TemplateReference templateReference() {
		LexicalContext.Mark start = ctx.mark();
		Optional<MatchResult> match = ctx.matchPattern(TEMPLATE_REFERENCE);
		if (!match.isPresent()) {
			return null;
		}
		MatchResult result = match.get();
		SourceLocation location = ctx.locationFrom(start);
		if (result.group(1) == null) {
			return new TemplateArgument(location, result.group(4));
		}
		int index;
		try {
			index = Integer.parseInt(result.group(1));
		} catch (NumberFormatException e) {
			throw error("template index " + result.group(1) + " is too large");
		}
		if (result.group(3) != null) {
			return new TemplateFieldReference(location, index, result.group(3));
		}
		return new TemplateKeyReference(location, index);
	}

	/**
	 * Reads @ref, ref, ... | condition@ at the current position.
	 *
	 * @return the declaration, or null with the position unchanged if there is none
	 */
	private TemplateDeclaration tryTemplateDeclaration() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		if (!ctx.matchString("@")) {
			return null;
		}
		List<TemplateReference> arguments = new ArrayList<>();
		do {
			skipWhitespace();
			TemplateReference argument = templateReference();
			if (argument == null) {
				ctx.restore(start);
				return null;
			}
			arguments.add(argument);
		} while (symbol(","));
		CubicleOrExpression condition = null;
		if (bar()) {
			condition = orExpression();
		}
		if (!symbol("@")) {
			ctx.restore(start);
			return null;
		}
		return new TemplateDeclaration(ctx.locationFrom(start), arguments, condition);
	}

	/**
	 * Reads a name: literal fragments and @ref@ placeholders, without whitespace in between.
	 *
	 * @return the name, or null if there is none at the current position
	 */
	private CubicleName tryName() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		List<String> fragments = new ArrayList<>();
		List<TemplateReference> references = new ArrayList<>();
		StringBuilder fragment = new StringBuilder();
		boolean empty = true;
		while (true) {
			Optional<MatchResult> literal = ctx.matchPattern(FRAGMENT);
			if (literal.isPresent()) {
				fragment.append(literal.get().group());
				empty = false;
				continue;
			}
			if (ctx.lookingAt("@")) {
				LexicalContext.Mark beforeReference = ctx.mark();
				ctx.skip();
				TemplateReference reference = templateReference();
				if (reference != null && ctx.matchString("@")) {
					fragments.add(fragment.toString());
					fragment = new StringBuilder();
					references.add(reference);
					empty = false;
					continue;
				}
				ctx.restore(beforeReference);
			}
			break;
		}
		if (empty) {
			return null;
		}
		fragments.add(fragment.toString());
		return new CubicleName(ctx.locationFrom(start), fragments, references);
	}

	private CubicleName name(String what) {
		CubicleName name = tryName();
		if (name == null) {
			throw error("expected " + what);
		}
		return name;
	}

	private CubicleReference reference(LexicalContext.Mark start, CubicleName name) {
		List<CubicleName> indices = new ArrayList<>();
		if (symbol("[")) {
			do {
				indices.add(name("array index"));
			} while (symbol(","));
			expectSymbol("]");
		}
		return new CubicleReference(ctx.locationFrom(start), name, indices);
	}

	private CubicleReference reference(String what) {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		return reference(start, name(what));
	}

	private CubicleExpression rvalue() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		Optional<MatchResult> constant = ctx.matchPattern(NUMBER);
		if (!constant.isPresent()) {
			constant = ctx.matchPattern(BOOLEAN);
		}
		if (constant.isPresent()) {
			return new CubicleConstant(ctx.locationFrom(start), constant.get().group());
		}
		return reference(start, name("expression"));
	}

	private CubicleExpression expression() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		CubicleExpression lhs = rvalue();
		skipWhitespace();
		Optional<MatchResult> operator = ctx.matchPattern(ARITHMETIC_OPERATOR);
		if (operator.isPresent()) {
			CubicleExpression rhs = rvalue();
			return new CubicleBinop(ctx.locationFrom(start), lhs, operator.get().group(), rhs);
		}
		return lhs;
	}

	private CubicleComparison comparison() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		CubicleExpression lhs = expression();
		skipWhitespace();
		String operator = ctx.matchPattern(COMPARISON_OPERATOR)
				.orElseThrow(() -> error("expected comparison operator")).group();
		CubicleExpression rhs = expression();
		return new CubicleComparison(ctx.locationFrom(start), lhs, operator, rhs);
	}

	private CubicleBoolExpression boolExpression() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		if (keyword("forall_other")) {
			String process = identifier("process variable");
			expectSymbol(".");
			if (symbol("(")) {
				CubicleOrExpression formula = orExpression();
				expectSymbol(")");
				return new CubicleForallOther(ctx.locationFrom(start), process, formula);
			}
			return new CubicleForallOther(ctx.locationFrom(start), process, comparison());
		}
		return comparison();
	}

	private CubicleAndElement andElement() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		if (ctx.lookingAt("@")) {
			TemplateDeclaration declaration = tryTemplateDeclaration();
			if (declaration != null && symbol("(") && symbol("&&")) {
				CubicleAndExpression body = andExpression();
				expectSymbol(")");
				return new CubicleAndIterator(ctx.locationFrom(start), declaration, body);
			}
			ctx.restore(start);
		}
		if (symbol("(")) {
			CubicleOrExpression nested = orExpression();
			expectSymbol(")");
			return new CubicleAndNestedOr(ctx.locationFrom(start), nested);
		}
		return new CubicleAndTerm(ctx.locationFrom(start), boolExpression());
	}

	private CubicleAndExpression andExpression() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		List<CubicleAndElement> elements = new ArrayList<>();
		do {
			elements.add(andElement());
		} while (symbol("&&"));
		return new CubicleAndExpression(ctx.locationFrom(start), elements);
	}

	private CubicleOrElement orElement() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		if (ctx.lookingAt("@")) {
			TemplateDeclaration declaration = tryTemplateDeclaration();
			if (declaration != null && symbol("(") && symbol("||")) {
				CubicleAndExpression body = andExpression();
				expectSymbol(")");
				return new CubicleOrIterator(ctx.locationFrom(start), declaration, body);
			}
			ctx.restore(start);
		}
		return new CubicleOrBranch(ctx.locationFrom(start), andExpression());
	}

	private CubicleOrExpression orExpression() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		List<CubicleOrElement> elements = new ArrayList<>();
		do {
			elements.add(orElement());
		} while (symbol("||"));
		return new CubicleOrExpression(ctx.locationFrom(start), elements);
	}

	private boolean isWildcard() {
		skipWhitespace();
		LexicalContext.Mark mark = ctx.mark();
		if (ctx.matchString("_") && !isNameChar(ctx.peek()) && ctx.peek() != '@') {
			return true;
		}
		ctx.restore(mark);
		return false;
	}

	private CubicleCaseElement caseElement() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		if (ctx.lookingAt("@")) {
			TemplateDeclaration declaration = tryTemplateDeclaration();
			if (declaration != null && symbol("(")) {
				List<CubicleCaseElement> body = new ArrayList<>();
				do {
					body.add(caseElement());
				} while (!symbol(")"));
				return new CubicleCaseIterator(ctx.locationFrom(start), declaration, body);
			}
			ctx.restore(start);
		}
		if (!bar()) {
			throw error("expected \"|\" starting a case");
		}
		CubicleAndExpression guard = null;
		if (!isWildcard()) {
			guard = andExpression();
		}
		expectSymbol(":");
		CubicleExpression value = expression();
		return new CubicleCase(ctx.locationFrom(start), guard, value);
	}

	private boolean lookingAtCase() {
		skipWhitespace();
		return ctx.lookingAt("|") || ctx.lookingAt("@");
	}

	private CubicleUpdate update() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		if (ctx.lookingAt("@")) {
			TemplateDeclaration declaration = tryTemplateDeclaration();
			if (declaration != null && symbol("(")) {
				List<CubicleUpdate> body = new ArrayList<>();
				while (!symbol(")")) {
					body.add(update());
				}
				return new CubicleUpdateIterator(ctx.locationFrom(start), declaration, body);
			}
			ctx.restore(start);
		}
		CubicleReference lhs = reference("assigned variable");
		expectSymbol(":=");
		skipWhitespace();
		LexicalContext.Mark rhsStart = ctx.mark();
		CubicleAssignValue rhs;
		if (keyword("case")) {
			List<CubicleCaseElement> cases = new ArrayList<>();
			do {
				cases.add(caseElement());
			} while (lookingAtCase());
			rhs = new CubicleSwitch(ctx.locationFrom(rhsStart), cases);
		} else if (symbol("?")) {
			rhs = new CubicleNondeterministic(ctx.locationFrom(rhsStart));
		} else {
			rhs = new CubicleExpressionValue(ctx.locationFrom(rhsStart), expression());
		}
		expectSymbol(";");
		return new CubicleAssignment(ctx.locationFrom(start), lhs, rhs);
	}

	private CubicleEnumElement enumElement() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		if (ctx.lookingAt("@")) {
			TemplateDeclaration declaration = tryTemplateDeclaration();
			if (declaration != null && symbol("(")) {
				List<CubicleEnumElement> body = new ArrayList<>();
				do {
					body.add(enumElement());
				} while (bar());
				expectSymbol(")");
				return new CubicleEnumIterator(ctx.locationFrom(start), declaration, body);
			}
			ctx.restore(start);
		}
		return new CubicleEnumName(ctx.locationFrom(start), name("constructor name"));
	}

	private List<String> processes() {
		expectSymbol("(");
		List<String> processes = new ArrayList<>();
		while (!symbol(")")) {
			processes.add(identifier("process variable"));
		}
		return processes;
	}

	/**
	 * @return the keyword of the next construct, skipping its template declaration, or null
	 */
	private String peekConstruct() {
		skipWhitespace();
		LexicalContext.Mark mark = ctx.mark();
		tryTemplateDeclaration();
		skipWhitespace();
		Optional<MatchResult> keyword = ctx.matchPattern(IDENTIFIER);
		ctx.restore(mark);
		return keyword.map(MatchResult::group).orElse(null);
	}

	private CubicleTypeDeclaration typeDeclaration() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		TemplateDeclaration declaration = tryTemplateDeclaration();
		expectKeyword("type");
		CubicleName name = name("type name");
		List<CubicleEnumElement> constructors = null;
		if (symbol("=")) {
			constructors = new ArrayList<>();
			bar();
			do {
				constructors.add(enumElement());
			} while (bar());
		}
		return new CubicleTypeDeclaration(ctx.locationFrom(start), declaration, name, constructors);
	}

	private CubicleVariableDeclaration variableDeclaration() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		TemplateDeclaration declaration = tryTemplateDeclaration();
		CubicleVariableDeclaration.Kind kind = CubicleVariableDeclaration.Kind.fromKeyword(identifier("declaration"));
		CubicleReference variable = reference("declared variable");
		expectSymbol(":");
		CubicleName type = name("type name");
		return new CubicleVariableDeclaration(ctx.locationFrom(start), declaration, kind, variable, type);
	}

	private CubicleProcExprConstruct procExprConstruct(CubicleProcExprConstruct.Kind kind) {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		TemplateDeclaration declaration = tryTemplateDeclaration();
		if (declaration != null && kind == CubicleProcExprConstruct.Kind.INIT) {
			throw error("init cannot be preceded by a template declaration");
		}
		expectKeyword(kind.getKeyword());
		List<String> processes = processes();
		expectSymbol("{");
		CubicleOrExpression formula = orExpression();
		expectSymbol("}");
		return new CubicleProcExprConstruct(ctx.locationFrom(start), declaration, kind, processes, formula);
	}

	private CubicleTransition transition() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		TemplateDeclaration declaration = tryTemplateDeclaration();
		expectKeyword("transition");
		CubicleName name = name("transition name");
		List<String> processes = processes();
		CubicleOrExpression guard = null;
		if (keyword("requires")) {
			expectSymbol("{");
			guard = orExpression();
			expectSymbol("}");
		}
		expectSymbol("{");
		List<CubicleUpdate> updates = new ArrayList<>();
		while (!symbol("}")) {
			updates.add(update());
		}
		return new CubicleTransition(ctx.locationFrom(start), declaration, name, processes, guard, updates);
	}

	private CubicleModel model() {
		skipWhitespace();
		LexicalContext.Mark start = ctx.mark();
		String processCount = null;
		if (keyword("number_procs")) {
			skipWhitespace();
			processCount = ctx.matchPattern(INTEGER).orElseThrow(() -> error("expected number of processes")).group();
		}
		List<CubicleTypeDeclaration> types = new ArrayList<>();
		while ("type".equals(peekConstruct())) {
			types.add(typeDeclaration());
		}
		List<CubicleVariableDeclaration> declarations = new ArrayList<>();
		while (CubicleVariableDeclaration.Kind.fromKeyword(peekConstruct()) != null) {
			declarations.add(variableDeclaration());
		}
		if (!CubicleProcExprConstruct.Kind.INIT.getKeyword().equals(peekConstruct())) {
			skipWhitespace();
			throw error("expected init");
		}
		CubicleProcExprConstruct init = procExprConstruct(CubicleProcExprConstruct.Kind.INIT);
		List<CubicleProcExprConstruct> invariants = new ArrayList<>();
		while (CubicleProcExprConstruct.Kind.INVARIANT.getKeyword().equals(peekConstruct())) {
			invariants.add(procExprConstruct(CubicleProcExprConstruct.Kind.INVARIANT));
		}
		List<CubicleProcExprConstruct> unsafes = new ArrayList<>();
		while (CubicleProcExprConstruct.Kind.UNSAFE.getKeyword().equals(peekConstruct())) {
			unsafes.add(procExprConstruct(CubicleProcExprConstruct.Kind.UNSAFE));
		}
		List<CubicleTransition> transitions = new ArrayList<>();
		while ("transition".equals(peekConstruct())) {
			transitions.add(transition());
		}
		return new CubicleModel(ctx.locationFrom(start), processCount, types, declarations, init, invariants,
				unsafes, transitions);
	}

}
