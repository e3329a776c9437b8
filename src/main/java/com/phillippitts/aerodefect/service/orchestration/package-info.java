/**
 * Job lifecycle: admission control, the per-job state machine, parallel detection under a deadline
 * and the coordinator that decides between full, degraded and failed outcomes.
 */
package com.phillippitts.aerodefect.service.orchestration;
