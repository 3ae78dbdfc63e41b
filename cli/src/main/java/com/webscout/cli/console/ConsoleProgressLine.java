package com.webscout.cli.console;

import com.webscout.core.model.ProgressSnapshot;
import com.webscout.core.util.ProgressListener;

import java.io.PrintStream;
import java.util.Objects;

/** 캐리지 리턴으로 한 줄을 덮어쓰는 스피너 진행 표시 */
public final class ConsoleProgressLine implements ProgressListener {

    static final String[] FRAMES = {"⣾", "⣽", "⣻", "⢿", "⡿", "⣟", "⣯", "⣷"};

    private final PrintStream out;
    private int frame = 0; // reporter 스레드에서만 접근

    public ConsoleProgressLine(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onProgress(ProgressSnapshot s) {
        out.print("\r" + FRAMES[frame] + " " + s);
        out.flush();
        frame = (frame + 1) % FRAMES.length;
    }

    @Override
    public void onFinished(ProgressSnapshot last) {
        out.println("\r" + FRAMES[frame] + " " + last);
        out.flush();
    }
}
