package com.goormthonuniv.videocheck.llm;

public interface InferenceProvider {
    /**
     * 영상 + 프롬프트를 보내고 자유 텍스트 응답을 받는다.
     * @throws InferenceException 네트워크/타임아웃/비정상(빈) 응답
     */
    String invoke(String prompt, byte[] media, String mimeType);

    /** API 키 등 호출에 필요한 설정이 갖춰졌는지 */
    boolean isConfigured();

    String name(); // "gemini"
}
