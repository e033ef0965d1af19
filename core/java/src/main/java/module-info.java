module io.github.cyfko.truthtable.core {
    requires java.logging;

    exports io.github.cyfko.truthtable.core;
    exports io.github.cyfko.truthtable.core.api;
    exports io.github.cyfko.truthtable.core.ast;
    exports io.github.cyfko.truthtable.core.config;
    exports io.github.cyfko.truthtable.core.evaluation;
    exports io.github.cyfko.truthtable.core.exception;
    exports io.github.cyfko.truthtable.core.impl;
    exports io.github.cyfko.truthtable.core.parsing;
    exports io.github.cyfko.truthtable.core.table;
    exports io.github.cyfko.truthtable.core.utils;
}
