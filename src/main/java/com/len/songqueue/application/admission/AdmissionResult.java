package com.len.songqueue.application.admission;

import com.len.songqueue.domain.request.SongRequest;
import com.len.songqueue.domain.venue.Track;

public record AdmissionResult(
        SongRequest request,
        Track track,
        int estimatedWaitMinutes
) {}
