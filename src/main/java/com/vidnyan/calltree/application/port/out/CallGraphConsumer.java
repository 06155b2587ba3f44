package com.vidnyan.calltree.application.port.out;

import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisResult;

import java.io.IOException;

/**
 * Port for whatever receives the finished graph (report renderer, traceability mapper, ...).
 */
public interface CallGraphConsumer {

    void consume(AnalysisResult result) throws IOException;
}
