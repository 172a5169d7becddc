package com.conductor.watch;

import lombok.*;

/**
 * One message on the works topic: {"op": "MODIFIED", "object": { ... }}
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WatchNotification {

    private WatchOp op;
    private WorkObject object;
}
