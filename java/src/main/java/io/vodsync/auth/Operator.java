package io.vodsync.auth;

/**
 * The human at the keyboard. All prompts are synchronous, and a {@code null} answer means the operator is gone
 * (end of input): the login is cancelled rather than asked again.
 */
public interface Operator {

    /**
     * @param previous last username entered during this login, or {@code null} on the first prompt.
     * @return the username; a blank answer means "keep {@code previous}".
     */
    String username(String previous);

    String password(String username);

    /**
     * @param image raw captcha image bytes as served by the identity provider.
     * @return the operator's transcription.
     */
    String captcha(byte[] image);
}
