package com.verilog.tools.parser;

import com.verilog.tools.parser.model.InstanceDeclaration;
import com.verilog.tools.parser.model.NetDeclaration;
import com.verilog.tools.parser.model.ParameterDeclaration;
import com.verilog.tools.parser.model.PortDeclaration;

/**
 * Receives the structural events raised by {@link StructuralParser}, in source order.
 * Every method defaults to doing nothing so listeners override only what they need.
 */
public interface ParserListener {

    default void moduleBegin(String name, int line) {
    }

    default void moduleEnd(int line) {
    }

    default void portDeclaration(PortDeclaration port) {
    }

    default void netDeclaration(NetDeclaration net) {
    }

    default void parameterDeclaration(ParameterDeclaration parameter) {
    }

    default void instanceDeclaration(InstanceDeclaration instance) {
    }

    default void alwaysBegin(int line) {
    }

    default void assign(int line) {
    }

    /**
     * A compiler directive left in the text, without its backtick.
     */
    default void directive(String text, int line, int column) {
    }

    /**
     * An identifier not consumed by any declaration or instance.
     */
    default void identifier(String text, int line, int column) {
    }

    default void endOfInput(int line) {
    }
}
