package com.hwsc.userservice.dto;

import com.hwsc.userservice.availability.ServiceState;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StatusResponse {

    private ServiceState state;
    private boolean storeReachable;
}
