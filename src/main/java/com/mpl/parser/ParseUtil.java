package com.mpl.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.mpl.formula.Formula;
import com.mpl.grammar.EpistemicLexer;
import com.mpl.grammar.EpistemicParser;
import com.mpl.grammar.EpistemicParserVisitor;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ConsoleErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

public final class ParseUtil {
  private ParseUtil() {
  }

  static Formula parse(String formula, EpistemicParserVisitor<Formula> visitor) {
    try {
      EpistemicLexer lexer = new EpistemicLexer(CharStreams.fromString(formula));
      lexer.removeErrorListener(ConsoleErrorListener.INSTANCE);
      lexer.addErrorListener(TokenErrorListener.INSTANCE);
      CommonTokenStream tokens = new CommonTokenStream(lexer);
      EpistemicParser parser = new EpistemicParser(tokens);
      parser.removeErrorListener(ConsoleErrorListener.INSTANCE);
      parser.setErrorHandler(new BailErrorStrategy());
      return visitor.visit(parser.formula());
    } catch (ParseCancellationException e) {
      throw new IllegalArgumentException("Failed to parse formula " + formula, e);
    }
  }

  static Stream<JsonElement> stream(JsonArray array) {
    return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
        Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
  }

  private static final class TokenErrorListener extends BaseErrorListener {
    static final TokenErrorListener INSTANCE = new TokenErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
        int charPositionInLine, String msg, RecognitionException e) {
      throw new ParseCancellationException("line %d:%d %s".formatted(line, charPositionInLine, msg), e);
    }
  }
}
