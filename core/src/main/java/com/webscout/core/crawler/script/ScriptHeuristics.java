package com.webscout.core.crawler.script;

import com.webscout.core.crawler.script.ScriptLexer.Kind;
import com.webscout.core.crawler.script.ScriptLexer.Token;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 토큰열 위의 두 가지 휴리스틱(서로 독립).
 * 완전성을 보장하지 않는 best-effort 추출이다.
 */
public final class ScriptHeuristics {
    private ScriptHeuristics() {}

    /** 호출 대상 이름 접미사: fetch(...), axios(...), new XMLHttpRequest(...) */
    private static final List<String> CALLEE_SUFFIXES = List.of("fetch", "axios", "xmlhttprequest");
    private static final Set<String> BINDING_KEYWORDS = Set.of("function", "const", "let", "var");
    /** 한 글자 식별자(압축된 코드의 a, b, e ...)는 버린다 */
    static final int MIN_IDENTIFIER_LENGTH = 2;

    /**
     * API 호출 대상: callee '(' "문자열" 패턴의 첫 번째 인자 문자열.
     * callee는 소문자 기준 fetch/axios/xmlhttprequest로 끝나는 식별자, 또는 '.' 뒤의 ajax.
     */
    public static List<String> apiCallTargets(List<Token> tokens) {
        List<String> out = new ArrayList<>();
        for (int k = 0; k + 2 < tokens.size(); k++) {
            Token t = tokens.get(k);
            if (t.kind() != Kind.IDENT || !isCallee(tokens, k)) continue;
            if (!tokens.get(k + 1).is(Kind.PUNCT, "(")) continue;
            Token arg = tokens.get(k + 2);
            if (arg.kind() == Kind.STRING && !arg.text().isBlank()) {
                out.add(arg.text().trim());
            }
        }
        return out;
    }

    private static boolean isCallee(List<Token> tokens, int k) {
        String name = tokens.get(k).text().toLowerCase(Locale.ROOT);
        for (String suffix : CALLEE_SUFFIXES) {
            if (name.endsWith(suffix)) return true;
        }
        return name.equals("ajax") && k > 0 && tokens.get(k - 1).is(Kind.PUNCT, ".");
    }

    /** function/const/let/var 바로 뒤의 식별자(키워드 자체는 제외) */
    public static Set<String> declaredFunctions(List<Token> tokens) {
        Set<String> out = new LinkedHashSet<>();
        for (int k = 0; k + 1 < tokens.size(); k++) {
            Token kw = tokens.get(k);
            if (kw.kind() != Kind.IDENT || !BINDING_KEYWORDS.contains(kw.text())) continue;
            if (k > 0 && tokens.get(k - 1).is(Kind.PUNCT, ".")) continue; // obj.var 같은 속성 접근
            Token id = tokens.get(k + 1);
            if (id.kind() == Kind.IDENT
                    && id.text().length() >= MIN_IDENTIFIER_LENGTH
                    && !BINDING_KEYWORDS.contains(id.text())) {
                out.add(id.text());
            }
        }
        return out;
    }
}
