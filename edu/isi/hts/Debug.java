package edu.isi.hts;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// messages for the user and for the developer, all on stderr
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    private static OutputStreamWriter w=null;
    private static void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }

    private static void write(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // stuff we always print to stderr
    public static void prettyDebug(String s) {
	write(s);
    }

    // recoverable oddities in the input: always printed, tagged with the caller
    public static void warn(String s) {
	write("Warning: "+caller()+" : "+s);
    }

    // true debugging stuff
    public static void debug(boolean d, String s)  {
	if (d)
	    debug(0, caller(), s);
    }
    public static void debug(boolean d, int i, String s) {
	if (d)
	    debug(i, caller(), s);
    }
    private static void debug(int i, String caller, String s) {
	StringBuilder sb = new StringBuilder();
	for (int x = 0; x < i; x++)
	    sb.append(' ');
	sb.append(caller).append(" : ").append(s);
	write(sb.toString());
    }

    // class:method of whoever called into Debug
    private static String caller() {
	StackTraceElement e = new Throwable().getStackTrace()[2];
	return e.getClassName()+":"+e.getMethodName();
    }

    private static int dblevel=0;
    public static void setDbLevel(int i) {
	dblevel = i;
    }
    public static int getDbLevel() {
	return dblevel;
    }

    // print time debug info if the level is proper
    public static void dbtime(int currlevel, int needlevel, Date pta, Date ptb, String msg) {
	if (currlevel < needlevel)
	    return;
	write(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
    }

    // global version of dbtime
    public static void dbtime(int needlevel, Date pta, String msg) {
	dbtime(dblevel, needlevel, pta, new Date(), msg);
    }

}
