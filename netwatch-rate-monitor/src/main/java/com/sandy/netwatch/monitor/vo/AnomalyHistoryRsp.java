package com.sandy.netwatch.monitor.vo;

import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AnomalyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyHistoryRsp {
    private String key;
    private List<AnomalyEvent> events;
    /** Counts per anomaly type since startup. */
    private Map<AnomalyType, Long> distribution;
}
