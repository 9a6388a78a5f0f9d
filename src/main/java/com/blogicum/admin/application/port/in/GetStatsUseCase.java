package com.blogicum.admin.application.port.in;

import com.blogicum.admin.application.port.out.AdminDataPort.DataCounts;

public interface GetStatsUseCase {
    DataCounts getStats();
}
