package com.webscout.cli.console;

import com.webscout.core.crawler.FindingListener;
import com.webscout.core.model.FindingType;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.Style;

import java.io.PrintStream;
import java.util.Objects;

/**
 * 첫 발견 즉시 한 줄 출력. 색상: html 파랑, backend 초록, function 노랑.
 * 진행 표시줄 위에 찍히므로 줄바꿈으로 시작한다.
 */
public final class ConsoleFindingPrinter implements FindingListener {

    private final PrintStream out;
    private final Ansi ansi;

    public ConsoleFindingPrinter(PrintStream out, Ansi ansi) {
        this.out = Objects.requireNonNull(out, "out");
        this.ansi = (ansi != null) ? ansi : Ansi.OFF;
    }

    @Override
    public void onFinding(FindingType type, String value) {
        out.println(format(type, value));
        out.flush();
    }

    String format(FindingType type, String value) {
        String line = "\n• " + type.label() + " found: " + value;
        if (!ansi.enabled()) return line;
        return colorOf(type).on() + line + Style.reset.on();
    }

    private static Style colorOf(FindingType type) {
        return switch (type) {
            case HTML -> Style.fg_blue;
            case BACKEND -> Style.fg_green;
            case FUNCTION -> Style.fg_yellow;
        };
    }
}
