package com.salesanalytics.dto.response;

import com.salesanalytics.recommendation.CoachingNudge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoachingNudgeResponse {

    private String title;

    private String suggestion;

    public static CoachingNudgeResponse from(CoachingNudge nudge) {
        return new CoachingNudgeResponse(nudge.title(), nudge.suggestion());
    }
}
