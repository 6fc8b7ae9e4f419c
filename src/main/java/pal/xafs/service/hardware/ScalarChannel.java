package pal.xafs.service.hardware;

/**
 * Scalar process variables of the monochromator and the fly-scan counter.
 */
public enum ScalarChannel {
    /** Theta setpoint; writing it starts a move */
    MOTOR_POSITION,
    MOTOR_SPEED,
    MOTOR_STOP,
    /** 1 when the motor is done moving, 0 while moving */
    MOTION_DONE,
    /** Degrees per encoder count */
    ENCODER_RESOLUTION,
    /** 1 for fly (buffered) counting, 0 for normal counting */
    CAPTURE_MODE,
    /** Encoder counts accumulated per buffered sample */
    CAPTURE_STEP_SIZE,
    CAPTURE_RESET,
    CAPTURE_PRESET
}
