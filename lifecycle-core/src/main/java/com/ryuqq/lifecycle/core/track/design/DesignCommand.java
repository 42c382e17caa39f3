package com.ryuqq.lifecycle.core.track.design;

import com.ryuqq.lifecycle.core.track.TrackCommand;

/**
 * Design Track 전용 명령.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public sealed interface DesignCommand extends TrackCommand
    permits AttachDesignSpec, AttachFigma, AttachWireframes {

    /**
     * 첨부할 참조.
     *
     * @return 참조 문자열
     */
    String ref();
}
