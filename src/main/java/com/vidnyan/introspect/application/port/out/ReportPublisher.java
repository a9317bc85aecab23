package com.vidnyan.introspect.application.port.out;

import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildResult;

/**
 * Port for publishing the diagnostic report of a build.
 */
public interface ReportPublisher {

    void publish(BuildResult result);
}
