package com.verilog.tools.preproc;

import lombok.Getter;

/**
 * One open {@code `ifdef}/{@code `ifndef} chain.
 *
 * {@code matched} becomes true with the first branch whose condition holds and stays true,
 * so later {@code `elsif}/{@code `else} branches of the chain are inactive.
 */
@Getter
class ConditionalFrame {

    enum Kind {
        IFDEF,
        IFNDEF
    }

    private final Kind kind;
    private final int line;
    private boolean active;
    private boolean matched;
    private boolean hadElse;

    ConditionalFrame(Kind kind, boolean condition, int line) {
        this.kind = kind;
        this.line = line;
        this.active = condition;
        this.matched = condition;
    }

    void elsif(boolean condition) {
        if (matched) {
            active = false;
        } else {
            active = condition;
            matched = condition;
        }
    }

    void otherwise() {
        hadElse = true;
        active = !matched;
        matched = true;
    }
}
