package com.webscout.core.crawler.script;

import java.util.ArrayList;
import java.util.List;

/**
 * 경량 JavaScript 토크나이저. 실행도, 완전한 파싱도 하지 않는다.
 * 주석은 건너뛰고 문자열/템플릿/식별자/숫자/구두점만 구분한다.
 * 정규식 리터럴은 구분하지 않으므로 적대적인 입력에서는 토큰이 어긋날 수 있다.
 */
public final class ScriptLexer {

    public enum Kind { IDENT, STRING, TEMPLATE, NUMBER, PUNCT }

    /** text: 식별자/구두점은 원문, 문자열은 따옴표를 뗀 값 */
    public record Token(Kind kind, String text, int offset) {
        public boolean is(Kind k, String t) { return kind == k && text.equals(t); }
    }

    private final String src;
    private final int n;
    private int i;

    private ScriptLexer(String src) {
        this.src = src == null ? "" : src;
        this.n = this.src.length();
    }

    public static List<Token> tokenize(String source) {
        return new ScriptLexer(source).run();
    }

    private List<Token> run() {
        List<Token> out = new ArrayList<>();
        while (i < n) {
            char c = src.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '/' && peek(1) == '/') {
                skipLineComment();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else if (c == '\'' || c == '"') {
                out.add(readString(c));
            } else if (c == '`') {
                out.add(readTemplate());
            } else if (isIdentStart(c)) {
                out.add(readWhile(Kind.IDENT, ScriptLexer::isIdentPart));
            } else if (Character.isDigit(c)) {
                out.add(readWhile(Kind.NUMBER, ch -> Character.isLetterOrDigit(ch) || ch == '.' || ch == '_'));
            } else {
                out.add(new Token(Kind.PUNCT, String.valueOf(c), i));
                i++;
            }
        }
        return out;
    }

    private char peek(int ahead) {
        int j = i + ahead;
        return j < n ? src.charAt(j) : '\0';
    }

    private void skipLineComment() {
        int nl = src.indexOf('\n', i);
        i = nl < 0 ? n : nl + 1;
    }

    private void skipBlockComment() {
        int end = src.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
    }

    /** 닫히지 않은 문자열은 줄 끝에서 끊는다 */
    private Token readString(char quote) {
        int start = i;
        StringBuilder sb = new StringBuilder();
        i++;
        while (i < n) {
            char ch = src.charAt(i);
            if (ch == '\\' && i + 1 < n) {
                sb.append(src.charAt(i + 1));
                i += 2;
                continue;
            }
            if (ch == quote) { i++; break; }
            if (ch == '\n') break;
            sb.append(ch);
            i++;
        }
        return new Token(Kind.STRING, sb.toString(), start);
    }

    private Token readTemplate() {
        int start = i;
        StringBuilder sb = new StringBuilder();
        i++;
        while (i < n) {
            char ch = src.charAt(i);
            if (ch == '\\' && i + 1 < n) {
                sb.append(src.charAt(i + 1));
                i += 2;
                continue;
            }
            i++;
            if (ch == '`') break;
            sb.append(ch);
        }
        return new Token(Kind.TEMPLATE, sb.toString(), start);
    }

    private interface CharTest { boolean test(char c); }

    private Token readWhile(Kind kind, CharTest t) {
        int start = i;
        while (i < n && t.test(src.charAt(i))) i++;
        return new Token(kind, src.substring(start, i), start);
    }

    static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
