package com.farm.anomaly.engine.baseline;

import lombok.Value;

@Value
class BaselineKey {
    String deviceId;
    String parameter;
}
