package fun.fengwk.mph.core.service.browser.session;

/**
 * Opens fetch sessions.
 *
 * @author fengwk
 */
public interface FetchSessionFactory {

    FetchSession open();

}
