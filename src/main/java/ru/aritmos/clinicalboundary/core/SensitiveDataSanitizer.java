package ru.aritmos.clinicalboundary.core;

/**
 * Санитайзер чувствительных данных для логов и журнала аудита.
 * <p>
 * Назначение:
 * <ul>
 *   <li>не допустить попадания контактов, идентификаторов и цитат в сообщения об ошибках;</li>
 *   <li>обеспечить единообразную политику «маскирования» текста, который уходит в аудит.</li>
 * </ul>
 * <p>
 * Важно:
 * <ul>
 *   <li>санитайзер не является DLP-системой и работает эвристически;</li>
 *   <li>границу безопасности обеспечивают фильтры, а не этот класс.</li>
 * </ul>
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    /**
     * Маска для скрытия чувствительных значений.
     */
    private static final String MASK = "***";

    /**
     * Максимальная длина сообщения, сохраняемого в аудит.
     */
    private static final int MAX_LENGTH = 500;

    /**
     * Санитизировать текст (сообщения об ошибках, диагностические строки).
     * <p>
     * Эвристика:
     * <ul>
     *   <li>маскируем e-mail;</li>
     *   <li>маскируем последовательности из 3+ цифр (телефоны, номера, даты);</li>
     *   <li>маскируем текст в кавычках.</li>
     * </ul>
     *
     * @param text исходный текст
     * @return санитизированный текст
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;

        t = t.replaceAll("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}", MASK);
        t = t.replaceAll("\\d[\\d\\s().-]{1,}\\d", MASK);
        t = t.replaceAll("\"[^\"]*\"", "\"" + MASK + "\"");

        // Избегаем многострочности в сообщениях.
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        if (t.length() > MAX_LENGTH) {
            t = t.substring(0, MAX_LENGTH);
        }
        return t;
    }

    /**
     * Сообщение об ошибке, пригодное для аудита: без контактов/цитат и без переносов строк.
     *
     * @param e исключение
     * @return безопасная строка (никогда не {@code null})
     */
    public static String describe(Throwable e) {
        if (e == null) {
            return "unknown";
        }
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + sanitizeText(msg);
    }
}
