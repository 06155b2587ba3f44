package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.FunctionSignature;

/**
 * A recognized header together with the position of its terminating '{' or ';'.
 *
 * @param signature the parsed header
 * @param terminatorLine index into the file's line list
 * @param terminatorColumn column of the terminator within that line
 */
record SignatureMatch(FunctionSignature signature, int terminatorLine, int terminatorColumn) {

    boolean isDefinition() {
        return signature.definition();
    }
}
